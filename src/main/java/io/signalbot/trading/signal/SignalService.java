package io.signalbot.trading.signal;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketDataCache;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import io.signalbot.trading.position.PositionStateMachine;
import io.signalbot.webhook.WebhookDeduplicator;
import io.signalbot.webhook.mapper.InboundSignalMapper;
import io.signalbot.webhook.model.InboundSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Webhook path: parse, drop duplicates, fetch fresh market data, then hand the signal to the state machine.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalService {
    static final int MAX_APPLY_ATTEMPTS = 3;

    private final InboundSignalMapper inboundSignalMapper;
    private final WebhookDeduplicator webhookDeduplicator;
    private final MarketDataCache marketDataCache;
    private final PositionStateMachine positionStateMachine;
    private final TradingProperties properties;

    public SignalOutcome handleWebhook(Map<String, Object> payload) {
        InboundSignal signal = inboundSignalMapper.fromPayload(payload);
        if (!webhookDeduplicator.accept(signal)) {
            return SignalOutcome.DUPLICATE;
        }

        String symbol = properties.getSymbol();
        for (int attempt = 1; ; attempt++) {
            long version = attempt < MAX_APPLY_ATTEMPTS
                    ? positionStateMachine.version(symbol)
                    : PositionStateMachine.ANY_VERSION;
            MarketSnapshot snapshot = marketDataCache.refresh();

            SignalOutcome outcome = positionStateMachine.applySignal(symbol, signal, snapshot, version);
            if (outcome != SignalOutcome.STALE) {
                log.info("Signal {} -> {}", signal.getStance(), outcome);
                return outcome;
            }
            log.info("Position changed during fetch, refetching (attempt {}/{})", attempt, MAX_APPLY_ATTEMPTS);
        }
    }
}
