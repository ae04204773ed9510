package io.signalbot.configs.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.market_data.snapshot.MarketSnapshot;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Configuration
public class CacheConfig {

    /**
     * Snapshot per symbol, expiring {@code trading.cache-ttl} after it was fetched.
     * Time comes from the application clock so tests can move it.
     */
    @Bean
    public Cache<String, MarketSnapshot> marketSnapshotCache(TradingProperties properties, Clock clock) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getCacheTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .maximumSize(10)
                .build();
    }
}
