package io.signalbot.market_data.snapshot;

import com.github.benmanes.caffeine.cache.Cache;
import io.signalbot.binance.VenueClient;
import io.signalbot.binance.model.PositionSizes;
import io.signalbot.configs.properties.TradingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;

/**
 * Short-lived memo of balance, price and position sizes for the traded symbol.
 * A failed venue read yields a snapshot with a zero price, cached like any other snapshot.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketDataCache {
    private final Cache<String, MarketSnapshot> marketSnapshotCache;
    private final VenueClient venueClient;
    private final TradingProperties properties;
    private final Clock clock;

    public MarketSnapshot get() {
        return marketSnapshotCache.get(properties.getSymbol(), this::fetch);
    }

    public void invalidate() {
        marketSnapshotCache.invalidate(properties.getSymbol());
    }

    /**
     * Invalidate + get. Used before every protective evaluation and every signal.
     */
    public MarketSnapshot refresh() {
        invalidate();
        return get();
    }

    private MarketSnapshot fetch(String symbol) {
        BigDecimal balance = venueClient.getBalance();
        BigDecimal price = venueClient.getPrice(symbol);
        PositionSizes sizes = venueClient.getPositions(symbol);

        if (balance == null || !sizes.known()) {
            // a partial read must not look like "no position": zero price makes every caller skip the cycle
            log.warn("⚠️ Incomplete market data: balance {}, positions {}, price discarded",
                    balance == null ? "unavailable" : "ok", sizes.known() ? "ok" : "unavailable");
            return MarketSnapshot.builder()
                    .balance(balance == null ? BigDecimal.ZERO : balance)
                    .price(BigDecimal.ZERO)
                    .longSize(BigDecimal.ZERO)
                    .shortSize(BigDecimal.ZERO)
                    .fetchedAt(clock.instant())
                    .build();
        }

        MarketSnapshot snapshot = MarketSnapshot.builder()
                .balance(balance)
                .price(price)
                .longSize(sizes.longSize())
                .shortSize(sizes.shortSize())
                .fetchedAt(clock.instant())
                .build();

        log.info("📊 Data: BAL=${} PRICE=${} L={} S={}",
                balance.setScale(2, RoundingMode.HALF_UP), price.setScale(4, RoundingMode.HALF_UP),
                sizes.longSize().toPlainString(), sizes.shortSize().toPlainString());
        return snapshot;
    }
}
