package io.signalbot.trading.risk;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.enums.PositionState;
import io.signalbot.trading.position.enums.TradingDirection;
import io.signalbot.trading.position.model.PositionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskEngine Tests")
class RiskEngineTest {

    private static final Instant NOW = Instant.parse("2025-01-10T12:00:00Z");

    private TradingProperties properties;
    private RiskEngine riskEngine;

    @BeforeEach
    void setUp() {
        properties = new TradingProperties();
        riskEngine = new RiskEngine(properties);
    }

    private static PositionRecord openLong(String entry) {
        return PositionRecord.builder()
                .side(TradingDirection.LONG)
                .size(new BigDecimal("3840"))
                .entryPrice(new BigDecimal(entry))
                .stopLossPrice(new BigDecimal("0.9825"))
                .state(PositionState.OPEN)
                .signalActive(true)
                .build();
    }

    private static MarketSnapshot snapshot(String price, String longSize, String shortSize) {
        return MarketSnapshot.builder()
                .balance(new BigDecimal("1000"))
                .price(new BigDecimal(price))
                .longSize(new BigDecimal(longSize))
                .shortSize(new BigDecimal(shortSize))
                .fetchedAt(NOW)
                .build();
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertNotNull(actual);
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Nested
    @DisplayName("Sizing and stop price")
    class Sizing {

        @Test
        @DisplayName("Should size 1000 USDT at 96% and 4x into 3840 units at price 1")
        void testCalculateQuantity() {
            assertDecimal("3840", riskEngine.calculateQuantity(new BigDecimal("1000"), new BigDecimal("1")));
            assertDecimal("7680", riskEngine.calculateQuantity(new BigDecimal("1000"), new BigDecimal("0.5")));
        }

        @Test
        @DisplayName("Should round the quantity down to the configured scale")
        void testQuantityRoundsDown() {
            // 3840 / 0.7 = 5485.71...
            assertDecimal("5485", riskEngine.calculateQuantity(new BigDecimal("1000"), new BigDecimal("0.7")));

            properties.setQuantityScale(1);
            assertDecimal("5485.7", riskEngine.calculateQuantity(new BigDecimal("1000"), new BigDecimal("0.7")));
        }

        @Test
        @DisplayName("Should return zero when exposure is below the minimum order value")
        void testQuantityBelowMinimum() {
            // 1 * 0.96 * 4 = 3.84 < 5
            assertDecimal("0", riskEngine.calculateQuantity(BigDecimal.ONE, BigDecimal.ONE));
            assertDecimal("0", riskEngine.calculateQuantity(new BigDecimal("1000"), BigDecimal.ZERO));
        }

        @Test
        @DisplayName("Should place the stop at stopLoss/leverage away from entry")
        void testStopLossPrice() {
            assertDecimal("0.9825", riskEngine.stopLossPrice(TradingDirection.LONG, BigDecimal.ONE));
            assertDecimal("1.0175", riskEngine.stopLossPrice(TradingDirection.SHORT, BigDecimal.ONE));
        }

        @Test
        @DisplayName("Should express the stop distance as leveraged capital at risk")
        void testCapitalAtRisk() {
            assertDecimal("0.07", riskEngine.capitalAtRisk(BigDecimal.ONE, new BigDecimal("0.9825")));
            assertTrue(riskEngine.capitalAtRisk(new BigDecimal("1.0106"), new BigDecimal("0.9825"))
                    .compareTo(new BigDecimal("0.11")) > 0);
        }

        @Test
        @DisplayName("Should compute directional unleveraged PnL")
        void testUnleveragedPnl() {
            assertDecimal("0.01", riskEngine.unleveragedPnl(TradingDirection.LONG, BigDecimal.ONE, new BigDecimal("1.01")));
            assertDecimal("0.01", riskEngine.unleveragedPnl(TradingDirection.SHORT, BigDecimal.ONE, new BigDecimal("0.99")));
            assertDecimal("0", riskEngine.unleveragedPnl(TradingDirection.LONG, null, BigDecimal.ONE));
            assertDecimal("0.04", riskEngine.leveraged(new BigDecimal("0.01")));
        }
    }

    @Nested
    @DisplayName("Stop loss")
    class StopLoss {

        @Test
        @DisplayName("Should trigger a long stop when price reaches the stop price")
        void testLongStopTriggered() {
            RiskDecision decision = riskEngine.stopLossCheck(openLong("1"), snapshot("0.98", "3840", "0"), NOW);

            assertEquals(RiskAction.STOP_LOSS, decision.getAction());
            assertDecimal("3840", decision.getQuantity());
            assertDecimal("-0.02", decision.getPnl());
        }

        @Test
        @DisplayName("Should not trigger above the long stop price")
        void testLongStopNotTriggered() {
            assertTrue(riskEngine.stopLossCheck(openLong("1"), snapshot("0.99", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should trigger a short stop when price rises to the stop price")
        void testShortStopTriggered() {
            PositionRecord record = openLong("1").toBuilder()
                    .side(TradingDirection.SHORT)
                    .stopLossPrice(new BigDecimal("1.0175"))
                    .build();

            RiskDecision decision = riskEngine.stopLossCheck(record, snapshot("1.02", "0", "3840"), NOW);

            assertEquals(RiskAction.STOP_LOSS, decision.getAction());
        }

        @Test
        @DisplayName("Should reconcile to flat when the venue no longer holds the position")
        void testReconcileWhenClosedExternally() {
            RiskDecision decision = riskEngine.stopLossCheck(openLong("1"), snapshot("1", "0", "0"), NOW);

            assertEquals(RiskAction.RECONCILE_FLAT, decision.getAction());
        }

        @Test
        @DisplayName("Should do nothing while the signal source is flat")
        void testInactive() {
            PositionRecord record = openLong("1").toBuilder().signalActive(false).build();

            assertTrue(riskEngine.stopLossCheck(record, snapshot("0.5", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should skip while the check interval has not elapsed")
        void testThrottled() {
            PositionRecord record = openLong("1").toBuilder().lastCheckAt(NOW.minusMillis(100)).build();

            assertTrue(riskEngine.stopLossCheck(record, snapshot("0.5", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should skip on an invalid price")
        void testInvalidPrice() {
            assertTrue(riskEngine.stopLossCheck(openLong("1"), snapshot("0", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should not run while profit is locked")
        void testNotWhileLocked() {
            PositionRecord record = openLong("1").toBuilder().state(PositionState.LOCKED).build();

            assertTrue(riskEngine.stopLossCheck(record, snapshot("1", "0", "0"), NOW).isNone());
        }
    }

    @Nested
    @DisplayName("Trailing profit")
    class Trailing {

        @Test
        @DisplayName("Should raise the peak when PnL exceeds it")
        void testRaisePeak() {
            RiskDecision decision = riskEngine.trailingProfitCheck(openLong("1"), snapshot("1.005", "3840", "0"), NOW);

            assertEquals(RiskAction.RAISE_PEAK, decision.getAction());
            assertDecimal("0.005", decision.getPeak());
        }

        @Test
        @DisplayName("Should lock profit after a 25% retracement from an activated peak")
        void testTrailingLock() {
            PositionRecord record = openLong("1").toBuilder().peakProfitPercent(new BigDecimal("0.01")).build();

            RiskDecision decision = riskEngine.trailingProfitCheck(record, snapshot("1.0075", "3840", "0"), NOW);

            assertEquals(RiskAction.TRAILING_LOCK, decision.getAction());
            assertDecimal("0.25", decision.getDrawdown());
            assertDecimal("3840", decision.getQuantity());
        }

        @Test
        @DisplayName("Should hold while retracement is below the drop fraction")
        void testTrailingHolds() {
            PositionRecord record = openLong("1").toBuilder().peakProfitPercent(new BigDecimal("0.01")).build();

            assertTrue(riskEngine.trailingProfitCheck(record, snapshot("1.008", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should not lock before the peak reaches the activation level")
        void testNotActivated() {
            PositionRecord record = openLong("1").toBuilder().peakProfitPercent(new BigDecimal("0.005")).build();

            assertTrue(riskEngine.trailingProfitCheck(record, snapshot("1.001", "3840", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should do nothing while the signal source is flat")
        void testInactive() {
            PositionRecord record = openLong("1").toBuilder()
                    .signalActive(false)
                    .peakProfitPercent(new BigDecimal("0.01"))
                    .build();

            assertSame(RiskDecision.none(), riskEngine.trailingProfitCheck(record, snapshot("1.0075", "3840", "0"), NOW));
            assertSame(RiskDecision.none(), riskEngine.trailingProfitCheck(record, snapshot("1.02", "3840", "0"), NOW));
        }

        @Test
        @DisplayName("Should wait for the protective cooldown")
        void testCooldown() {
            PositionRecord record = openLong("1").toBuilder()
                    .peakProfitPercent(new BigDecimal("0.01"))
                    .lastProtectiveActionAt(NOW.minus(Duration.ofSeconds(1)))
                    .build();

            assertTrue(riskEngine.trailingProfitCheck(record, snapshot("1.0075", "3840", "0"), NOW).isNone());
        }
    }

    @Nested
    @DisplayName("Re-entry")
    class Reentry {

        private PositionRecord locked(int attempts) {
            return openLong("0.98").toBuilder()
                    .state(PositionState.LOCKED)
                    .reentryPrice(new BigDecimal("0.99"))
                    .reentryAttempts(attempts)
                    .build();
        }

        @Test
        @DisplayName("Should re-enter when price moves 0.3% back in favour from the lock price")
        void testReentry() {
            RiskDecision decision = riskEngine.reentryCheck(locked(0), snapshot("0.993", "0", "0"), NOW);

            assertEquals(RiskAction.REENTRY, decision.getAction());
            assertTrue(decision.getGainFromClose().compareTo(new BigDecimal("0.003")) >= 0);
            // 3840 / 0.993
            assertDecimal("3867", decision.getQuantity());
        }

        @Test
        @DisplayName("Should wait while the move from the lock price is too small")
        void testBelowThreshold() {
            assertTrue(riskEngine.reentryCheck(locked(0), snapshot("0.992", "0", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should stop after the maximum number of attempts")
        void testAttemptsBound() {
            assertTrue(riskEngine.reentryCheck(locked(3), snapshot("0.999", "0", "0"), NOW).isNone());
        }

        @Test
        @DisplayName("Should do nothing while the signal source is flat")
        void testInactive() {
            PositionRecord record = locked(0).toBuilder().signalActive(false).build();

            assertSame(RiskDecision.none(), riskEngine.reentryCheck(record, snapshot("0.999", "0", "0"), NOW));
        }

        @Test
        @DisplayName("Should only apply to a locked position")
        void testOnlyWhenLocked() {
            PositionRecord record = locked(0).toBuilder().state(PositionState.OPEN).build();

            assertTrue(riskEngine.reentryCheck(record, snapshot("0.999", "3840", "0"), NOW).isNone());
        }
    }
}
