package io.signalbot.webhook;

import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.webhook.model.InboundSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drops a webhook whose payload equals the last accepted one when it arrives inside the dedup window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookDeduplicator {
    private final TradingProperties properties;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private Instant lastAcceptedAt;
    private String lastPayload;

    public boolean accept(InboundSignal signal) {
        String payload = signal.getCanonicalPayload();
        Instant now = clock.instant();

        lock.lock();
        try {
            if (lastAcceptedAt != null
                    && payload.equals(lastPayload)
                    && Duration.between(lastAcceptedAt, now).compareTo(properties.getDedupWindow()) < 0) {
                log.info("⏭️ SKIP: duplicate webhook (< {} ms)", properties.getDedupWindow().toMillis());
                return false;
            }
            lastAcceptedAt = now;
            lastPayload = payload;
            return true;
        } finally {
            lock.unlock();
        }
    }
}
