package io.signalbot.binance;

import com.binance.connector.futures.client.exceptions.BinanceConnectorException;
import com.binance.connector.futures.client.exceptions.BinanceServerException;
import com.binance.connector.futures.client.impl.UMFuturesClientImpl;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.signalbot.binance.model.PositionSizes;
import io.signalbot.binance.order.enums.OrderSide;
import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.configs.properties.TradingProperties;
import io.signalbot.trading.position.enums.TradingDirection;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.function.Supplier;

/**
 * Binance USDⓈ-M futures implementation of {@link VenueClient}.
 * Reads are retried on 5xx and connection failures; orders are sent once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceVenueClient implements VenueClient {
    static final int MAX_ATTEMPTS = 3;
    static final long INITIAL_BACKOFF_MS = 300;

    private final UMFuturesClientImpl umFuturesClient;
    private final ObjectMapper objectMapper;
    private final TradingProperties properties;

    @Override
    public BigDecimal getBalance() {
        try {
            String result = withRetry("balance", () -> umFuturesClient.account().futuresAccountBalance(new LinkedHashMap<>()));
            JsonNode arrayNode = objectMapper.readTree(result);
            for (JsonNode node : arrayNode) {
                if (properties.getMarginAsset().equalsIgnoreCase(node.path("asset").asText())) {
                    return safeParseBigDecimal(node, "availableBalance");
                }
            }
            log.warn("⚠️ Margin asset {} not found in futures balance", properties.getMarginAsset());
        } catch (Exception e) {
            log.error("❌ Failed to get balance: {}", e.getMessage());
        }
        return null;
    }

    @Override
    public BigDecimal getPrice(String symbol) {
        try {
            LinkedHashMap<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());

            String result = withRetry("price", () -> umFuturesClient.market().tickerSymbol(params));
            return safeParseBigDecimal(objectMapper.readTree(result), "price");
        } catch (Exception e) {
            log.error("❌ Failed to get price for {}: {}", symbol, e.getMessage());
            return BigDecimal.ZERO;
        }
    }

    @Override
    public PositionSizes getPositions(String symbol) {
        try {
            LinkedHashMap<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());

            String result = withRetry("positions", () -> umFuturesClient.account().positionInformation(params));
            JsonNode arrayNode = objectMapper.readTree(result);

            BigDecimal longSize = BigDecimal.ZERO;
            BigDecimal shortSize = BigDecimal.ZERO;
            for (JsonNode node : arrayNode) {
                if (!symbol.equalsIgnoreCase(node.path("symbol").asText())) continue;

                BigDecimal amount = safeParseBigDecimal(node, "positionAmt");
                switch (node.path("positionSide").asText("BOTH")) {
                    case "LONG" -> longSize = longSize.add(amount.abs());
                    case "SHORT" -> shortSize = shortSize.add(amount.abs());
                    default -> {
                        // one-way mode: the sign carries the side
                        if (amount.signum() > 0) longSize = longSize.add(amount);
                        else if (amount.signum() < 0) shortSize = shortSize.add(amount.abs());
                    }
                }
            }
            return new PositionSizes(longSize, shortSize);
        } catch (Exception e) {
            log.error("❌ Failed to get positions for {}: {}", symbol, e.getMessage());
            return PositionSizes.unknown();
        }
    }

    @Override
    public OrderResult placeMarketOrder(String symbol, OrderSide side, TradingDirection positionSide, BigDecimal quantity, boolean reduceOnly) {
        if (quantity == null || quantity.signum() <= 0) {
            return OrderResult.failed(symbol, side, quantity, "quantity must be positive");
        }
        try {
            LinkedHashMap<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("symbol", symbol.toUpperCase());
            parameters.put("side", side.name());
            parameters.put("type", "MARKET");
            parameters.put("quantity", quantity.toPlainString());

            if (properties.isHedgeMode()) {
                // hedge mode: the position side says which leg is opened/reduced, reduceOnly is rejected by the venue
                parameters.put("positionSide", positionSide.name());
            } else if (reduceOnly) {
                parameters.put("reduceOnly", "true");
            }

            log.info("📤 Sending market order: {}", parameters);
            String result = umFuturesClient.account().newOrder(parameters);
            log.info("📥 Market order response: {}", result);

            JsonNode json = objectMapper.readTree(result);
            return OrderResult.builder()
                    .success(true)
                    .orderId(json.hasNonNull("orderId") ? json.get("orderId").asLong() : null)
                    .symbol(symbol)
                    .side(side)
                    .quantity(quantity)
                    .message(json.path("status").asText(""))
                    .build();
        } catch (Exception e) {
            log.error("❌ Failed to place market order: symbol={}, side={}, positionSide={}, qty={}: {}",
                    symbol, side, positionSide, quantity, e.getMessage());
            return OrderResult.failed(symbol, side, quantity, e.getMessage());
        }
    }

    @Override
    public Long getServerTime() {
        try {
            String result = withRetry("server time", () -> umFuturesClient.market().time());
            JsonNode json = objectMapper.readTree(result);
            return json.hasNonNull("serverTime") ? json.get("serverTime").asLong() : null;
        } catch (Exception e) {
            log.error("❌ Failed to get server time: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public void configureAccount(String symbol, int leverage, boolean isolated, boolean hedgeMode) {
        setPositionMode(hedgeMode);
        setLeverage(symbol, leverage);
        setMarginType(symbol, isolated);
    }

    void setPositionMode(boolean hedgeMode) {
        try {
            LinkedHashMap<String, Object> params = new LinkedHashMap<>();
            params.put("dualSidePosition", String.valueOf(hedgeMode));
            String response = umFuturesClient.account().changePositionModeTrade(params);
            log.info("✅ Position mode set: hedge={}, response={}", hedgeMode, response);
        } catch (Exception e) {
            if (hasCode(e, -4059)) {
                log.info("✅ Position mode already hedge={} (received -4059), continuing.", hedgeMode);
            } else {
                log.error("❌ Failed to set position mode hedge={}: {}", hedgeMode, e.getMessage());
            }
        }
    }

    void setLeverage(String symbol, int leverage) {
        try {
            LinkedHashMap<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());
            params.put("leverage", leverage);
            String response = umFuturesClient.account().changeInitialLeverage(params);
            log.info("✅ Leverage set: symbol={}, leverage={}, response={}", symbol, leverage, response);
        } catch (Exception e) {
            log.error("❌ Failed to set leverage: symbol={}, leverage={}: {}", symbol, leverage, e.getMessage());
        }
    }

    void setMarginType(String symbol, boolean isolated) {
        try {
            LinkedHashMap<String, Object> params = new LinkedHashMap<>();
            params.put("symbol", symbol.toUpperCase());
            params.put("marginType", isolated ? "ISOLATED" : "CROSSED");
            String response = umFuturesClient.account().changeMarginType(params);
            log.info("✅ Margin type set: symbol={}, isolated={}, response={}", symbol, isolated, response);
        } catch (Exception e) {
            if (hasCode(e, -4046)) {
                log.info("✅ Margin type already set: symbol={}, isolated={}", symbol, isolated);
            } else if (hasCode(e, -4048)) {
                log.warn("❌ Cannot change margin type: open position exists for symbol={}, isolated={}", symbol, isolated);
            } else {
                log.error("❌ Failed to set margin type: symbol={}, isolated={}: {}", symbol, isolated, e.getMessage());
            }
        }
    }

    /**
     * Retries transient failures (5xx, connection errors) with doubling backoff.
     * Client errors (4xx) fail immediately.
     */
    <T> T withRetry(String operation, Supplier<T> call) {
        long delayMs = INITIAL_BACKOFF_MS;
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return call.get();
            } catch (BinanceServerException | BinanceConnectorException e) {
                if (attempt >= MAX_ATTEMPTS) {
                    throw new VenueException(operation + " failed after " + attempt + " attempts: " + e.getMessage(), e);
                }
                log.warn("⚠️ {} failed (attempt {}/{}), retrying in {} ms: {}", operation, attempt, MAX_ATTEMPTS, delayMs, e.getMessage());
                sleep(delayMs, operation, e);
                delayMs *= 2;
            } catch (RuntimeException e) {
                throw new VenueException(operation + " failed: " + e.getMessage(), e);
            }
        }
    }

    private void sleep(long delayMs, String operation, RuntimeException cause) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new VenueException(operation + " interrupted while backing off", cause);
        }
    }

    private static boolean hasCode(Exception e, int code) {
        return e.getMessage() != null && e.getMessage().contains("\"code\":" + code);
    }

    private static BigDecimal safeParseBigDecimal(JsonNode json, String fieldName) {
        if (json.has(fieldName) && !json.get(fieldName).isNull()) {
            String value = json.get(fieldName).asText();
            if (value != null && !value.trim().isEmpty()) {
                return new BigDecimal(value);
            }
        }
        return BigDecimal.ZERO;
    }
}
