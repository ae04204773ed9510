package io.signalbot.trading.risk;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RiskDecision {
    private static final RiskDecision NONE = RiskDecision.builder().action(RiskAction.NONE).build();

    RiskAction action;
    BigDecimal price;
    BigDecimal pnl;              // unleveraged, vs entry
    BigDecimal peak;
    BigDecimal drawdown;         // share of the peak given back
    BigDecimal gainFromClose;    // unleveraged, vs reentry price
    BigDecimal quantity;         // venue size to close, or size to re-open

    public static RiskDecision none() {
        return NONE;
    }

    public boolean isNone() {
        return action == RiskAction.NONE;
    }
}
