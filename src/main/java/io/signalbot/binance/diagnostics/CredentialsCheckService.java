package io.signalbot.binance.diagnostics;

import io.signalbot.binance.VenueClient;
import io.signalbot.configs.service.AppConfig;
import io.signalbot.controller.dto.CredentialsReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Connectivity and credential check. Never exposes more than a short key prefix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialsCheckService {
    static final int KEY_PREFIX_LENGTH = 8;

    private final AppConfig appConfig;
    private final VenueClient venueClient;

    public CredentialsReport check() {
        String apiKey = appConfig.getApiKey();
        String secretKey = appConfig.getSecretKey();

        Long serverTime = venueClient.getServerTime();
        BigDecimal balance = venueClient.getBalance();
        String balanceTest = balance != null ? "success" : "failed";
        log.info("🔍 Credentials check: serverTime={}, balance={}, result={}", serverTime, balance, balanceTest);

        return CredentialsReport.builder()
                .serverTime(serverTime)
                .apiKeyLength(apiKey.length())
                .apiSecretLength(secretKey.length())
                .apiKeyPrefix(apiKey.isEmpty() ? "empty" : apiKey.substring(0, Math.min(KEY_PREFIX_LENGTH, apiKey.length())))
                .credentialsLoaded(appConfig.isCredentialsLoaded())
                .balanceTest(balanceTest)
                .balance(balance)
                .build();
    }
}
