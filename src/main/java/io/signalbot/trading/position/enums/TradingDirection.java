package io.signalbot.trading.position.enums;

import io.signalbot.binance.order.enums.OrderSide;

import java.util.Locale;

public enum TradingDirection {
    LONG,
    SHORT,
    FLAT;

    /**
     * Parses a stance as sent by the signal source ("long", "Short", "FLAT"...).
     * Returns null for blank or unknown values.
     */
    public static TradingDirection fromString(String value) {
        if (value == null || value.isBlank()) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "long" -> LONG;
            case "short" -> SHORT;
            case "flat" -> FLAT;
            default -> null;
        };
    }

    public TradingDirection opposite() {
        return switch (this) {
            case LONG -> SHORT;
            case SHORT -> LONG;
            case FLAT -> FLAT;
        };
    }

    public boolean isDirectional() {
        return this != FLAT;
    }

    public OrderSide openingSide() {
        requireDirectional();
        return this == LONG ? OrderSide.BUY : OrderSide.SELL;
    }

    public OrderSide closingSide() {
        requireDirectional();
        return this == LONG ? OrderSide.SELL : OrderSide.BUY;
    }

    public String lowerCase() {
        return name().toLowerCase(Locale.ROOT);
    }

    private void requireDirectional() {
        if (this == FLAT) {
            throw new IllegalStateException("FLAT has no order side");
        }
    }
}
