package io.signalbot.binance.order.service;

import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.trading.position.enums.TradingDirection;

import java.math.BigDecimal;

public interface OrderService {
    OrderResult open(String symbol, TradingDirection direction, BigDecimal quantity);

    OrderResult close(String symbol, TradingDirection direction, BigDecimal quantity);
}
