package io.signalbot.binance.order.service;

import io.signalbot.binance.VenueClient;
import io.signalbot.binance.order.enums.OrderSide;
import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.trading.position.enums.TradingDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderServiceImpl implements OrderService {
    private final VenueClient venueClient;

    @Override
    public OrderResult open(String symbol, TradingDirection direction, BigDecimal quantity) {
        if (!direction.isDirectional()) {
            throw new IllegalArgumentException("Cannot open a FLAT position");
        }
        OrderSide side = direction.openingSide();
        if (quantity == null || quantity.signum() <= 0) {
            log.warn("⚠️ Skip open {} {}: quantity {}", symbol, direction, quantity);
            return OrderResult.failed(symbol, side, quantity, "quantity must be positive");
        }

        log.info("🚀 OPEN {} {} MARKET qty={}", symbol, direction, quantity.toPlainString());
        OrderResult result = venueClient.placeMarketOrder(symbol, side, direction, quantity, false);
        if (result.isSuccess()) {
            log.info("✅ OPEN {} MARKET OK: orderId={}", side, result.getOrderId());
        } else {
            log.error("❌ OPEN {} {} failed: {}", symbol, direction, result.getMessage());
        }
        return result;
    }

    @Override
    public OrderResult close(String symbol, TradingDirection direction, BigDecimal quantity) {
        if (!direction.isDirectional()) {
            throw new IllegalArgumentException("Cannot close a FLAT position");
        }
        OrderSide side = direction.closingSide();
        if (quantity == null || quantity.signum() <= 0) {
            log.warn("⚠️ Skip close {} {}: quantity {}", symbol, direction, quantity);
            return OrderResult.failed(symbol, side, quantity, "quantity must be positive");
        }

        log.info("🔒 CLOSE {} {} MARKET qty={}", symbol, direction, quantity.toPlainString());
        OrderResult result = venueClient.placeMarketOrder(symbol, side, direction, quantity, true);
        if (result.isSuccess()) {
            log.info("✅ CLOSE {} MARKET OK: orderId={}", side, result.getOrderId());
        } else {
            log.error("❌ CLOSE {} {} failed: {}", symbol, direction, result.getMessage());
        }
        return result;
    }
}
