package io.signalbot.trading.risk;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.enums.TradingDirection;
import io.signalbot.trading.position.model.PositionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Stop-loss, trailing-profit and re-entry decisions.
 * <p>
 * The procedures only read the record and the snapshot; applying the returned
 * {@link RiskDecision} (orders and state changes) is up to the caller.
 * Profit figures are unleveraged price fractions; leverage is applied for display only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskEngine {
    static final MathContext MC = MathContext.DECIMAL64;

    private final TradingProperties properties;

    // ================= STOP LOSS =================

    public RiskDecision stopLossCheck(PositionRecord record, MarketSnapshot snapshot, Instant now) {
        if (!record.isSignalActive() || !record.isTracking() || !record.isOpen()) return RiskDecision.none();
        if (!isCheckDue(record, now)) return RiskDecision.none();
        if (snapshot == null || !snapshot.isPriceValid()) return RiskDecision.none();

        TradingDirection side = record.getSide();
        BigDecimal price = snapshot.getPrice();
        BigDecimal actualSize = snapshot.sizeFor(side);

        if (actualSize.signum() == 0 && record.getSize().signum() > 0) {
            return RiskDecision.builder()
                    .action(RiskAction.RECONCILE_FLAT)
                    .price(price)
                    .quantity(BigDecimal.ZERO)
                    .build();
        }

        BigDecimal stop = record.getStopLossPrice();
        if (stop == null) return RiskDecision.none();

        boolean triggered = side == TradingDirection.LONG
                ? price.compareTo(stop) <= 0
                : price.compareTo(stop) >= 0;
        if (!triggered) return RiskDecision.none();

        return RiskDecision.builder()
                .action(RiskAction.STOP_LOSS)
                .price(price)
                .pnl(unleveragedPnl(side, record.getEntryPrice(), price))
                .quantity(actualSize)
                .build();
    }

    // ================= TRAILING PROFIT =================

    public RiskDecision trailingProfitCheck(PositionRecord record, MarketSnapshot snapshot, Instant now) {
        if (!record.isSignalActive() || !record.isTracking() || !record.isOpen()) return RiskDecision.none();
        if (!isCheckDue(record, now) || !isCooldownOver(record, now)) return RiskDecision.none();
        if (snapshot == null || !snapshot.isPriceValid()) return RiskDecision.none();

        BigDecimal price = snapshot.getPrice();
        BigDecimal pnl = unleveragedPnl(record.getSide(), record.getEntryPrice(), price);
        BigDecimal peak = nvl(record.getPeakProfitPercent());

        if (pnl.compareTo(peak) > 0) {
            return RiskDecision.builder()
                    .action(RiskAction.RAISE_PEAK)
                    .price(price)
                    .pnl(pnl)
                    .peak(pnl)
                    .build();
        }

        if (peak.compareTo(properties.getTrailingActivationFraction()) < 0 || peak.signum() <= 0) {
            return RiskDecision.none();
        }

        BigDecimal drawdown = peak.subtract(pnl).divide(peak, MC);
        if (drawdown.compareTo(properties.getTrailingDropFraction()) < 0) return RiskDecision.none();

        return RiskDecision.builder()
                .action(RiskAction.TRAILING_LOCK)
                .price(price)
                .pnl(pnl)
                .peak(peak)
                .drawdown(drawdown)
                .quantity(snapshot.sizeFor(record.getSide()))
                .build();
    }

    // ================= RE-ENTRY =================

    public RiskDecision reentryCheck(PositionRecord record, MarketSnapshot snapshot, Instant now) {
        if (!record.isSignalActive() || !record.isTracking() || !record.isLocked()) return RiskDecision.none();
        if (record.getReentryAttempts() >= properties.getMaxReentryAttempts()) return RiskDecision.none();
        if (!isCooldownOver(record, now)) return RiskDecision.none();
        if (snapshot == null || !snapshot.isPriceValid() || record.getReentryPrice() == null) return RiskDecision.none();

        TradingDirection side = record.getSide();
        BigDecimal price = snapshot.getPrice();
        BigDecimal gain = unleveragedPnl(side, record.getReentryPrice(), price);
        if (gain.compareTo(properties.getReentryThreshold()) < 0) return RiskDecision.none();

        return RiskDecision.builder()
                .action(RiskAction.REENTRY)
                .price(price)
                .gainFromClose(gain)
                .pnl(unleveragedPnl(side, record.getEntryPrice(), price))
                .quantity(calculateQuantity(snapshot.getBalance(), price))
                .build();
    }

    // ================= SHARED MATH =================

    /**
     * entry * (1 - stopLoss/leverage) for long, entry * (1 + stopLoss/leverage) for short.
     */
    public BigDecimal stopLossPrice(TradingDirection side, BigDecimal entry) {
        BigDecimal delta = properties.getStopLossPercent().divide(BigDecimal.valueOf(properties.getLeverage()), MC);
        BigDecimal factor = side == TradingDirection.LONG ? BigDecimal.ONE.subtract(delta) : BigDecimal.ONE.add(delta);
        return entry.multiply(factor, MC);
    }

    /**
     * exposure = balance * positionSizeFraction * leverage; 0 when below the venue minimum,
     * otherwise exposure / price rounded down.
     */
    public BigDecimal calculateQuantity(BigDecimal balance, BigDecimal price) {
        if (balance == null || price == null || balance.signum() <= 0 || price.signum() <= 0) return BigDecimal.ZERO;

        BigDecimal exposure = balance
                .multiply(properties.getPositionSizeFraction(), MC)
                .multiply(BigDecimal.valueOf(properties.getLeverage()), MC);

        if (exposure.compareTo(properties.getMinOrderValue()) < 0) {
            log.warn("⚠️ Exposure {} < min order value {}", s2(exposure), properties.getMinOrderValue());
            return BigDecimal.ZERO;
        }

        BigDecimal quantity = exposure.divide(price, MC).setScale(properties.getQuantityScale(), RoundingMode.DOWN);
        log.info("🧮 ${} * {}% * {}x = ${} QTY: {}", s2(balance),
                properties.getPositionSizeFraction().movePointRight(2).stripTrailingZeros().toPlainString(),
                properties.getLeverage(), s2(exposure), quantity.toPlainString());
        return quantity;
    }

    /**
     * Leveraged loss if price moves from {@code price} to {@code stop}.
     */
    public BigDecimal capitalAtRisk(BigDecimal price, BigDecimal stop) {
        if (price == null || stop == null || price.signum() <= 0) return BigDecimal.ZERO;
        return leveraged(price.subtract(stop).abs().divide(price, MC));
    }

    /**
     * Directional price move relative to {@code reference}, without leverage.
     */
    public BigDecimal unleveragedPnl(TradingDirection side, BigDecimal reference, BigDecimal price) {
        if (reference == null || reference.signum() <= 0 || price == null) return BigDecimal.ZERO;
        BigDecimal move = price.subtract(reference).divide(reference, MC);
        return side == TradingDirection.SHORT ? move.negate() : move;
    }

    public BigDecimal leveraged(BigDecimal fraction) {
        return nvl(fraction).multiply(BigDecimal.valueOf(properties.getLeverage()), MC);
    }

    public boolean isCheckDue(PositionRecord record, Instant now) {
        return elapsed(record.getLastCheckAt(), now, properties.getCheckInterval());
    }

    public boolean isCooldownOver(PositionRecord record, Instant now) {
        return elapsed(record.getLastProtectiveActionAt(), now, properties.getProtectiveCooldown());
    }

    private static boolean elapsed(Instant since, Instant now, Duration interval) {
        return since == null || Duration.between(since, now).compareTo(interval) >= 0;
    }

    private static BigDecimal nvl(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }

    private static BigDecimal s2(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }
}
