package io.signalbot.trading.position.model;

import io.signalbot.trading.position.enums.PositionState;
import io.signalbot.trading.position.enums.TradingDirection;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * The single tracked position. Mutated only by {@code PositionStateMachine} while holding the position lock.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class PositionRecord {
    @Builder.Default
    private TradingDirection side = TradingDirection.FLAT;
    @Builder.Default
    private BigDecimal size = BigDecimal.ZERO;
    private BigDecimal entryPrice;
    private BigDecimal stopLossPrice;
    @Builder.Default
    private BigDecimal peakProfitPercent = BigDecimal.ZERO;   // unleveraged fraction
    @Builder.Default
    private PositionState state = PositionState.FLAT;

    private BigDecimal reentryPrice;
    private int reentryAttempts;

    private Instant lastCheckAt;
    private Instant lastProtectiveActionAt;
    private Instant openedAt;

    // master gate for stop-loss / trailing / re-entry
    private boolean signalActive;
    private TradingDirection externalStance;

    // bumped on every lifecycle transition
    private long version;

    public static PositionRecord flat() {
        return PositionRecord.builder().build();
    }

    public boolean isTracking() {
        return side != TradingDirection.FLAT;
    }

    public boolean isOpen() {
        return state == PositionState.OPEN;
    }

    public boolean isLocked() {
        return state == PositionState.LOCKED;
    }

    public PositionRecord copy() {
        return toBuilder().build();
    }

    /**
     * Forgets the leg (side, size, prices, trailing and re-entry memory). Keeps signal flags.
     */
    public void clearLeg() {
        side = TradingDirection.FLAT;
        size = BigDecimal.ZERO;
        entryPrice = null;
        stopLossPrice = null;
        peakProfitPercent = BigDecimal.ZERO;
        state = PositionState.FLAT;
        reentryPrice = null;
        reentryAttempts = 0;
        openedAt = null;
        version++;
    }

    public void startLeg(TradingDirection direction, BigDecimal quantity, BigDecimal entry, BigDecimal stop, Instant now) {
        side = direction;
        size = quantity;
        entryPrice = entry;
        stopLossPrice = stop;
        peakProfitPercent = BigDecimal.ZERO;
        state = PositionState.OPEN;
        reentryPrice = null;
        reentryAttempts = 0;
        openedAt = now;
        lastProtectiveActionAt = now;
        version++;
    }

    public void lock(BigDecimal closePrice, Instant now) {
        state = PositionState.LOCKED;
        reentryPrice = closePrice;
        reentryAttempts = 0;
        lastProtectiveActionAt = now;
        version++;
    }

    public void reopen(BigDecimal quantity, BigDecimal peak) {
        state = PositionState.OPEN;
        size = quantity;
        peakProfitPercent = peak;
        version++;
    }
}
