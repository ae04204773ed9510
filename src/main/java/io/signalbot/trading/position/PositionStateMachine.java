package io.signalbot.trading.position;

import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.binance.order.service.OrderService;
import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.enums.PositionState;
import io.signalbot.trading.position.enums.TradingDirection;
import io.signalbot.trading.position.model.PositionRecord;
import io.signalbot.trading.risk.RiskAction;
import io.signalbot.trading.risk.RiskDecision;
import io.signalbot.trading.risk.RiskEngine;
import io.signalbot.trading.signal.SignalOutcome;
import io.signalbot.utils.LockType;
import io.signalbot.utils.lock.single_lock.WithLock;
import io.signalbot.utils.logging.TradingLogWriter;
import io.signalbot.webhook.model.InboundSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Owner of the tracked {@link PositionRecord}.
 * <p>
 * Every public method runs under the position lock for {@code symbol}. Market data is fetched by the
 * caller before the lock is taken; {@code expectedVersion} is the record version the caller saw at that
 * moment, and a mismatch means a transition happened in between.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionStateMachine {
    public static final long ANY_VERSION = -1;

    private final TradingProperties properties;
    private final RiskEngine riskEngine;
    private final OrderService orderService;
    private final TradingLogWriter tradingLogWriter;
    private final Clock clock;

    private final PositionRecord record = PositionRecord.flat();

    // ================= READS =================

    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public PositionRecord snapshot(String symbol) {
        requireTracked(symbol);
        return record.copy();
    }

    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public long version(String symbol) {
        requireTracked(symbol);
        return record.getVersion();
    }

    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public boolean isSignalActive(String symbol) {
        requireTracked(symbol);
        return record.isSignalActive();
    }

    /**
     * True while there is something to protect: the signal source is directional and a leg is tracked.
     */
    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public boolean needsProtection(String symbol) {
        requireTracked(symbol);
        return record.isSignalActive() && record.isTracking();
    }

    // ================= SIGNALS =================

    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public SignalOutcome applySignal(String symbol, InboundSignal signal, MarketSnapshot snapshot, long expectedVersion) {
        requireTracked(symbol);
        if (isStale(expectedVersion)) return SignalOutcome.STALE;

        TradingDirection stance = signal.getStance();
        log.info(">> SIGNAL: {} [{}min] PREV: {}", String.valueOf(signal.getRawStance()).toUpperCase(), signal.getTimeframe(),
                signal.getPreviousStance() == null ? "-" : signal.getPreviousStance());

        if (stance == null) {
            log.warn("⚠️ Unknown stance '{}', ignoring", signal.getRawStance());
            return SignalOutcome.IGNORED;
        }
        record.setExternalStance(stance);

        if (snapshot == null || !snapshot.isValid()) {
            log.error("❌ Invalid market data: balance={}, price={}",
                    snapshot == null ? null : snapshot.getBalance(), snapshot == null ? null : snapshot.getPrice());
            return SignalOutcome.INVALID_DATA;
        }

        return stance == TradingDirection.FLAT
                ? flatten(symbol, snapshot)
                : enter(symbol, stance, snapshot);
    }

    private SignalOutcome enter(String symbol, TradingDirection direction, MarketSnapshot snapshot) {
        record.setSignalActive(true);

        if (snapshot.sizeFor(direction).signum() > 0) {
            log.info("⏭️ SKIP: already {}", direction);
            return SignalOutcome.ALREADY_POSITIONED;
        }

        TradingDirection opposite = direction.opposite();
        BigDecimal opposingSize = snapshot.sizeFor(opposite);
        if (opposingSize.signum() > 0) {
            log.info("🔄 CLOSE {} -> OPEN {}", opposite, direction);
            OrderResult closed = orderService.close(symbol, opposite, opposingSize);
            if (!closed.isSuccess()) {
                log.error("❌ Could not close {} before reversing, {} not opened", opposite, direction);
                return SignalOutcome.ORDER_FAILED;
            }
            if (record.isTracking()) {
                PositionState before = record.getState();
                record.clearLeg();
                journal(symbol, before, "closed " + opposite + " " + opposingSize.toPlainString() + " for reversal");
            }
            settle();
        } else {
            log.info("🚀 OPEN {}", direction);
        }

        BigDecimal quantity = riskEngine.calculateQuantity(snapshot.getBalance(), snapshot.getPrice());
        if (quantity.signum() <= 0) {
            return SignalOutcome.REJECTED_SIZE;
        }

        OrderResult opened = orderService.open(symbol, direction, quantity);
        if (!opened.isSuccess()) {
            return SignalOutcome.ORDER_FAILED;
        }

        PositionState before = record.getState();
        BigDecimal entry = snapshot.getPrice();
        BigDecimal stop = riskEngine.stopLossPrice(direction, entry);
        record.startLeg(direction, quantity, entry, stop, clock.instant());

        log.info("🛡️ STOP: ${} | ENTRY: ${}", p4(stop), p4(entry));
        journal(symbol, before, String.format("open %s qty=%s entry=%s stop=%s",
                direction, quantity.toPlainString(), entry.toPlainString(), p4(stop)));
        return SignalOutcome.OPENED;
    }

    private SignalOutcome flatten(String symbol, MarketSnapshot snapshot) {
        log.info("🏁 SIGNAL FLAT: close all positions");
        PositionState before = record.getState();

        closeIfHeld(symbol, TradingDirection.LONG, snapshot.getLongSize());
        closeIfHeld(symbol, TradingDirection.SHORT, snapshot.getShortSize());

        record.clearLeg();
        record.setSignalActive(false);
        record.setLastCheckAt(null);
        record.setLastProtectiveActionAt(null);

        log.warn("⚠️ Signal source closed the position - all protections DISABLED");
        journal(symbol, before, "signal flat, protections disabled");
        return SignalOutcome.FLATTENED;
    }

    private void closeIfHeld(String symbol, TradingDirection side, BigDecimal size) {
        if (size == null || size.signum() <= 0) return;
        log.info("🔒 CLOSE {}", side);
        OrderResult result = orderService.close(symbol, side, size);
        if (!result.isSuccess()) {
            log.error("❌ Flat signal could not close {} {}: {}", side, size.toPlainString(), result.getMessage());
        }
    }

    private void settle() {
        Duration delay = properties.getFlipSettleDelay();
        if (delay.isZero()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the reversal close to settle", e);
        }
    }

    // ================= RISK CYCLE =================

    /**
     * Runs stop-loss, trailing and re-entry against {@code snapshot}. Stop-loss goes first and,
     * when it acts, ends the cycle.
     *
     * @return the action that changed the position, {@link RiskAction#NONE} otherwise
     */
    @WithLock(registry = LockType.POSITION, keyParam = "symbol")
    public RiskAction applyRiskCycle(String symbol, MarketSnapshot snapshot, long expectedVersion) {
        requireTracked(symbol);
        if (isStale(expectedVersion)) {
            log.debug("Position changed while fetching market data, skipping risk cycle");
            return RiskAction.NONE;
        }
        if (!record.isSignalActive() || !record.isTracking()) return RiskAction.NONE;

        Instant now = clock.instant();
        boolean checkDue = riskEngine.isCheckDue(record, now);
        try {
            RiskDecision stopLoss = riskEngine.stopLossCheck(record, snapshot, now);
            if (!stopLoss.isNone()) return apply(symbol, stopLoss, now);

            RiskDecision trailing = riskEngine.trailingProfitCheck(record, snapshot, now);
            if (!trailing.isNone()) return apply(symbol, trailing, now);

            return apply(symbol, riskEngine.reentryCheck(record, snapshot, now), now);
        } finally {
            if (checkDue) record.setLastCheckAt(now);
        }
    }

    private RiskAction apply(String symbol, RiskDecision decision, Instant now) {
        return switch (decision.getAction()) {
            case NONE -> RiskAction.NONE;
            case RECONCILE_FLAT -> reconcileFlat(symbol);
            case STOP_LOSS -> stopLoss(symbol, decision);
            case RAISE_PEAK -> raisePeak(decision);
            case TRAILING_LOCK -> lockProfit(symbol, decision, now);
            case REENTRY -> reenter(symbol, decision, now);
        };
    }

    private RiskAction reconcileFlat(String symbol) {
        log.warn("⚠️ {} {} closed outside the bot! Cleaning tracker", symbol, record.getSide());
        PositionState before = record.getState();
        record.clearLeg();
        journal(symbol, before, "venue reports zero size, closed externally");
        return RiskAction.RECONCILE_FLAT;
    }

    private RiskAction stopLoss(String symbol, RiskDecision decision) {
        TradingDirection side = record.getSide();
        log.warn("🚨 STOP LOSS TRIGGERED!");
        log.warn("Entry: ${} | Current: ${} | Stop: ${}", p4(record.getEntryPrice()), p4(decision.getPrice()), p4(record.getStopLossPrice()));
        log.warn("Loss: {}% | CLOSING MARKET", pct(riskEngine.leveraged(decision.getPnl())));

        OrderResult result = orderService.close(symbol, side, decision.getQuantity());
        if (!result.isSuccess()) {
            log.error("❌ Stop loss close failed, will retry next cycle");
            return RiskAction.NONE;
        }

        PositionState before = record.getState();
        record.clearLeg();
        log.info("✅ Stop loss executed");
        journal(symbol, before, String.format("stop loss %s @ %s pnl=%s%% (x%d)",
                side, decision.getPrice().toPlainString(), pct(riskEngine.leveraged(decision.getPnl())), properties.getLeverage()));
        return RiskAction.STOP_LOSS;
    }

    private RiskAction raisePeak(RiskDecision decision) {
        BigDecimal previous = record.getPeakProfitPercent();
        BigDecimal peak = decision.getPeak();
        record.setPeakProfitPercent(peak);

        BigDecimal activation = properties.getTrailingActivationFraction();
        if (peak.compareTo(activation) >= 0 && previous.compareTo(activation) < 0) {
            log.info("📈 Peak profit: {}% (trailing active)", pct(peak));
        } else {
            log.debug("📈 Peak profit: {}% -> {}%", pct(previous), pct(peak));
        }
        return RiskAction.RAISE_PEAK;
    }

    private RiskAction lockProfit(String symbol, RiskDecision decision, Instant now) {
        BigDecimal lockedLeveraged = riskEngine.leveraged(decision.getPnl());
        log.info("💰 TRAILING PROFIT TRIGGERED!");
        log.info("Peak: {}% | Current: {}% | Drop: {}%", pct(decision.getPeak()), pct(decision.getPnl()), pct(decision.getDrawdown()));
        log.info("Locking profit at {}% (with {}x leverage)", pct(lockedLeveraged), properties.getLeverage());

        OrderResult result = orderService.close(symbol, record.getSide(), decision.getQuantity());
        if (!result.isSuccess()) {
            log.error("❌ Trailing close failed, will retry next cycle");
            return RiskAction.NONE;
        }

        PositionState before = record.getState();
        record.lock(decision.getPrice(), now);
        log.info("✅ Profit locked | Net gain: {}%", pct(lockedLeveraged));
        journal(symbol, before, String.format("trailing lock @ %s peak=%s%% pnl=%s%%",
                decision.getPrice().toPlainString(), pct(decision.getPeak()), pct(decision.getPnl())));
        return RiskAction.TRAILING_LOCK;
    }

    private RiskAction reenter(String symbol, RiskDecision decision, Instant now) {
        // every attempt counts, including declined and failed ones
        record.setReentryAttempts(record.getReentryAttempts() + 1);
        record.setLastProtectiveActionAt(now);

        TradingDirection side = record.getSide();
        log.info("🔄 REENTRY TRIGGERED (attempt {}/{})", record.getReentryAttempts(), properties.getMaxReentryAttempts());
        log.info("Close: ${} | Current: ${} | Gain: {}%", p4(record.getReentryPrice()), p4(decision.getPrice()), pct(decision.getGainFromClose()));
        log.info("Price back to {}% profit vs original entry", pct(decision.getPnl()));

        BigDecimal quantity = decision.getQuantity();
        if (quantity == null || quantity.signum() <= 0) {
            log.warn("⚠️ Re-entry declined: order quantity is zero");
            return RiskAction.NONE;
        }

        OrderResult result = orderService.open(symbol, side, quantity);
        if (!result.isSuccess()) {
            log.error("❌ Re-entry order failed");
            return RiskAction.NONE;
        }

        PositionState before = record.getState();
        record.reopen(quantity, decision.getPnl().max(BigDecimal.ZERO));

        // the original leg's stop is kept, so the capital at risk differs from the configured stop
        BigDecimal stop = record.getStopLossPrice();
        BigDecimal risk = riskEngine.capitalAtRisk(decision.getPrice(), stop);
        log.info("✅ Reentered {} | STOP: ${} | capital at risk: {}% (configured {}%)",
                side, p4(stop), pct(risk), pct(properties.getStopLossPercent()));
        journal(symbol, before, String.format("re-entry %d %s qty=%s @ %s stop=%s risk=%s%%",
                record.getReentryAttempts(), side, quantity.toPlainString(), decision.getPrice().toPlainString(),
                p4(stop), pct(risk)));
        return RiskAction.REENTRY;
    }

    // ================= HELPERS =================

    private boolean isStale(long expectedVersion) {
        return expectedVersion != ANY_VERSION && record.getVersion() != expectedVersion;
    }

    private void requireTracked(String symbol) {
        if (!properties.getSymbol().equalsIgnoreCase(symbol)) {
            throw new IllegalArgumentException("Untracked symbol: " + symbol);
        }
    }

    private void journal(String symbol, PositionState before, String detail) {
        tradingLogWriter.writeTransition(symbol, before, record.getState(), detail);
    }

    private static BigDecimal p4(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v.setScale(4, RoundingMode.HALF_UP);
    }

    private static BigDecimal pct(BigDecimal fraction) {
        return fraction == null ? BigDecimal.ZERO : fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP);
    }
}
