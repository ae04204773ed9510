package io.signalbot.binance.order.enums;

public enum OrderSide {
    BUY,
    SELL
}
