package io.signalbot.controller;

import io.signalbot.controller.dto.WebhookResponse;
import io.signalbot.trading.signal.SignalOutcome;
import io.signalbot.trading.signal.SignalService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class WebhookController {
    private final SignalService signalService;

    @Operation(summary = "Receive a strategy signal: {marketPosition, prevMarketPosition, timeframe}")
    @PostMapping("/webhook")
    public ResponseEntity<WebhookResponse> webhook(@RequestBody(required = false) Map<String, Object> payload) {
        log.info("📨 Webhook received: {}", payload);
        try {
            SignalOutcome outcome = signalService.handleWebhook(payload);
            if (outcome == SignalOutcome.DUPLICATE) {
                return ResponseEntity.ok(WebhookResponse.duplicate());
            }
            if (outcome.isError()) {
                return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(WebhookResponse.error(null));
            }
            return ResponseEntity.ok(WebhookResponse.ok());
        } catch (Exception e) {
            log.error("❌ Webhook handling failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(WebhookResponse.error(e.getMessage()));
        }
    }
}
