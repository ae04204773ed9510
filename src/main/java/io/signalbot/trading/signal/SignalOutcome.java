package io.signalbot.trading.signal;

public enum SignalOutcome {
    OPENED,
    ALREADY_POSITIONED,
    FLATTENED,
    REJECTED_SIZE,      // exposure below the venue minimum
    ORDER_FAILED,
    INVALID_DATA,       // non-positive balance or price
    IGNORED,            // unknown stance
    DUPLICATE,
    STALE;              // position changed while market data was being fetched

    public boolean isError() {
        return this == INVALID_DATA;
    }
}
