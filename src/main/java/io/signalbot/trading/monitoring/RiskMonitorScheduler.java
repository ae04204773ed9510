package io.signalbot.trading.monitoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives the risk cycle on a timer, so protections run even when nobody pings /health.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "trading", name = "monitor-enabled", havingValue = "true", matchIfMissing = true)
public class RiskMonitorScheduler {
    private final RiskMonitorService riskMonitorService;

    @Scheduled(initialDelay = 5_000, fixedDelayString = "${trading.monitor-interval-ms:1000}")
    public void tick() {
        try {
            riskMonitorService.onHealthTick();
        } catch (Exception e) {
            log.error("❌ Scheduled risk cycle failed", e);
        }
    }
}
