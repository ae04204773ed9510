package io.signalbot.webhook.model;

import io.signalbot.trading.position.enums.TradingDirection;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InboundSignal {
    TradingDirection stance;          // null when the source sent something unknown
    TradingDirection previousStance;
    String rawStance;
    String timeframe;
    String canonicalPayload;
}
