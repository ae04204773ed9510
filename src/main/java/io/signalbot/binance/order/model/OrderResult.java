package io.signalbot.binance.order.model;

import io.signalbot.binance.order.enums.OrderSide;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Builder
@AllArgsConstructor
@ToString
public class OrderResult {
    private final boolean success;
    private final Long orderId;
    private final String symbol;
    private final OrderSide side;
    private final BigDecimal quantity;
    private final String message;

    public static OrderResult failed(String symbol, OrderSide side, BigDecimal quantity, String message) {
        return OrderResult.builder()
                .success(false)
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .message(message)
                .build();
    }
}
