package io.signalbot.trading.position.enums;

public enum PositionState {
    FLAT,    // nothing tracked
    OPEN,    // live position on the venue
    LOCKED   // profit locked by trailing, side/entry remembered, zero size on the venue
}
