package io.signalbot.controller;

import io.signalbot.binance.diagnostics.CredentialsCheckService;
import io.signalbot.controller.dto.CredentialsReport;
import io.signalbot.controller.dto.StatusDto;
import io.signalbot.trading.monitoring.RiskMonitorService;
import io.signalbot.trading.status.StatusService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class BotController {
    private final RiskMonitorService riskMonitorService;
    private final StatusService statusService;
    private final CredentialsCheckService credentialsCheckService;

    @GetMapping("/")
    public String home() {
        return "Signal bot running";
    }

    /**
     * Liveness endpoint. Also drives one protective cycle, so external pingers double as a heartbeat.
     */
    @Operation(summary = "Liveness check, runs one risk cycle when a position is active")
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        try {
            riskMonitorService.onHealthTick();
        } catch (Exception e) {
            log.error("❌ Risk cycle failed on health tick", e);
        }
        return ResponseEntity.ok("OK");
    }

    @Operation(summary = "Current position, market data and PnL")
    @GetMapping("/status")
    public ResponseEntity<StatusDto> status() {
        return ResponseEntity.ok(statusService.getStatus());
    }

    @Operation(summary = "Check venue connectivity and credentials")
    @GetMapping("/test-credentials")
    public ResponseEntity<CredentialsReport> testCredentials() {
        return ResponseEntity.ok(credentialsCheckService.check());
    }
}
