package io.signalbot.binance;

import io.signalbot.binance.model.PositionSizes;
import io.signalbot.binance.order.enums.OrderSide;
import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.trading.position.enums.TradingDirection;

import java.math.BigDecimal;

/**
 * Authenticated access to the futures venue. Implementations never throw on transport
 * or venue errors: reads return sentinels (null, zero price, unknown sizes) and orders return a failed {@link OrderResult}.
 */
public interface VenueClient {

    /** Available balance of the margin asset, null when it could not be read. */
    BigDecimal getBalance();

    /** Last traded price, 0 when unknown. */
    BigDecimal getPrice(String symbol);

    /** Absolute long and short sizes for the symbol, {@link PositionSizes#unknown()} when they could not be read. */
    PositionSizes getPositions(String symbol);

    OrderResult placeMarketOrder(String symbol, OrderSide side, TradingDirection positionSide, BigDecimal quantity, boolean reduceOnly);

    /** Venue server time in epoch millis, null when unreachable. */
    Long getServerTime();

    void configureAccount(String symbol, int leverage, boolean isolated, boolean hedgeMode);
}
