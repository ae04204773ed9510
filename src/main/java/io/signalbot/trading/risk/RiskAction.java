package io.signalbot.trading.risk;

public enum RiskAction {
    NONE,
    RECONCILE_FLAT,  // venue shows zero size for the tracked side: closed outside the bot
    STOP_LOSS,
    RAISE_PEAK,
    TRAILING_LOCK,
    REENTRY;

    public boolean placesOrder() {
        return this == STOP_LOSS || this == TRAILING_LOCK || this == REENTRY;
    }
}
