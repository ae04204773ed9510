package io.signalbot.configs.service;

import com.binance.connector.futures.client.impl.UMFuturesClientImpl;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Getter
@Configuration
public class AppConfig {

    @Value("${binance.url}")
    private String binanceUrl;

    @Value("${api.key:}")
    private String apiKey;

    @Value("${secret.key:}")
    private String secretKey;

    @Bean
    public UMFuturesClientImpl umFuturesClient() {
        log.info("BINANCE_URL {}", binanceUrl);
        return new UMFuturesClientImpl(apiKey, secretKey, binanceUrl);
    }

    public boolean isCredentialsLoaded() {
        return !apiKey.isBlank() && !secretKey.isBlank();
    }
}
