package io.signalbot.configs.service;

import io.signalbot.binance.VenueClient;
import io.signalbot.configs.properties.TradingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StartApp implements ApplicationRunner {
    private final TradingProperties properties;
    private final AppConfig appConfig;
    private final VenueClient venueClient;

    @Override
    public void run(ApplicationArguments args) {
        log.info("🚀 Signal bot starting: symbol={}, leverage={}x, size={}%, SL={}%, trailing drop={}%, hedge={}",
                properties.getSymbol(), properties.getLeverage(),
                properties.getPositionSizeFraction().movePointRight(2).stripTrailingZeros().toPlainString(),
                properties.getStopLossPercent().movePointRight(2).stripTrailingZeros().toPlainString(),
                properties.getTrailingDropFraction().movePointRight(2).stripTrailingZeros().toPlainString(),
                properties.isHedgeMode());
        log.info("🔑 API key length={}, secret length={}", appConfig.getApiKey().length(), appConfig.getSecretKey().length());
        if (!appConfig.isCredentialsLoaded()) {
            log.warn("⚠️ Binance credentials are not set, orders will be rejected");
        }

        try {
            log.info("✅ call -> venueClient.configureAccount()");
            venueClient.configureAccount(properties.getSymbol(), properties.getLeverage(),
                    properties.isIsolatedMargin(), properties.isHedgeMode());
        } catch (Exception e) {
            log.error("❌ Account setup failed, continuing with current venue settings", e);
        }
    }
}
