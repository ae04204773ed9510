package io.signalbot.binance.model;

import java.math.BigDecimal;

/**
 * Absolute long and short sizes. {@code known} is false when the venue could not be read,
 * which is not the same as holding nothing.
 */
public record PositionSizes(BigDecimal longSize, BigDecimal shortSize, boolean known) {

    public PositionSizes(BigDecimal longSize, BigDecimal shortSize) {
        this(longSize, shortSize, true);
    }

    public static PositionSizes empty() {
        return new PositionSizes(BigDecimal.ZERO, BigDecimal.ZERO, true);
    }

    public static PositionSizes unknown() {
        return new PositionSizes(BigDecimal.ZERO, BigDecimal.ZERO, false);
    }
}
