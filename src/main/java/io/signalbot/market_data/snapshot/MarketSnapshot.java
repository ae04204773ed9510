package io.signalbot.market_data.snapshot;

import io.signalbot.trading.position.enums.TradingDirection;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class MarketSnapshot {
    BigDecimal balance;
    BigDecimal price;
    BigDecimal longSize;
    BigDecimal shortSize;
    Instant fetchedAt;

    public boolean isPriceValid() {
        return price != null && price.signum() > 0;
    }

    public boolean isValid() {
        return isPriceValid() && balance != null && balance.signum() > 0;
    }

    public BigDecimal sizeFor(TradingDirection direction) {
        return switch (direction) {
            case LONG -> nvl(longSize);
            case SHORT -> nvl(shortSize);
            case FLAT -> BigDecimal.ZERO;
        };
    }

    /**
     * Position as the venue sees it; long wins if both sides are somehow held.
     */
    public TradingDirection actualPosition() {
        if (nvl(longSize).signum() > 0) return TradingDirection.LONG;
        if (nvl(shortSize).signum() > 0) return TradingDirection.SHORT;
        return TradingDirection.FLAT;
    }

    private static BigDecimal nvl(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
