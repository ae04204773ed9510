package io.signalbot.webhook.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.signalbot.trading.position.enums.TradingDirection;
import io.signalbot.webhook.model.InboundSignal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Maps the raw webhook body ({marketPosition, prevMarketPosition, timeframe}) to an {@link InboundSignal}.
 */
@Component
@RequiredArgsConstructor
public class InboundSignalMapper {
    private static final String DEFAULT_TIMEFRAME = "?";

    private final ObjectMapper objectMapper;

    public InboundSignal fromPayload(Map<String, Object> payload) {
        Map<String, Object> body = payload == null ? Collections.emptyMap() : payload;

        String rawStance = safeGetText(body, "marketPosition");
        String timeframe = safeGetText(body, "timeframe");

        return InboundSignal.builder()
                .stance(TradingDirection.fromString(rawStance))
                .previousStance(TradingDirection.fromString(safeGetText(body, "prevMarketPosition")))
                .rawStance(rawStance)
                .timeframe(timeframe.isEmpty() ? DEFAULT_TIMEFRAME : timeframe)
                .canonicalPayload(canonical(body))
                .build();
    }

    /**
     * JSON with map keys sorted at every level, so equal payloads serialize equally whatever the key order.
     */
    String canonical(Map<String, Object> body) {
        try {
            return objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Webhook payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private static String safeGetText(Map<String, Object> body, String field) {
        Object value = body.get(field);
        return value == null ? "" : value.toString().trim();
    }
}
