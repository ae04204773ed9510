package io.signalbot.binance.order.service;

import io.signalbot.binance.VenueClient;
import io.signalbot.binance.order.enums.OrderSide;
import io.signalbot.binance.order.model.OrderResult;
import io.signalbot.trading.position.enums.TradingDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderServiceImpl Tests")
class OrderServiceImplTest {

    private static final String SYMBOL = "WLFIUSDT";
    private static final BigDecimal QTY = new BigDecimal("3840");

    @Mock
    private VenueClient venueClient;

    @InjectMocks
    private OrderServiceImpl orderService;

    private static OrderResult ok(OrderSide side) {
        return OrderResult.builder().success(true).orderId(7L).symbol(SYMBOL).side(side).quantity(QTY).build();
    }

    @Test
    @DisplayName("Should open a long with a BUY on the LONG leg")
    void testOpenLong() {
        // Given
        when(venueClient.placeMarketOrder(SYMBOL, OrderSide.BUY, TradingDirection.LONG, QTY, false)).thenReturn(ok(OrderSide.BUY));

        // When
        OrderResult result = orderService.open(SYMBOL, TradingDirection.LONG, QTY);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(7L, result.getOrderId());
    }

    @Test
    @DisplayName("Should open a short with a SELL on the SHORT leg")
    void testOpenShort() {
        when(venueClient.placeMarketOrder(SYMBOL, OrderSide.SELL, TradingDirection.SHORT, QTY, false)).thenReturn(ok(OrderSide.SELL));

        assertTrue(orderService.open(SYMBOL, TradingDirection.SHORT, QTY).isSuccess());
    }

    @Test
    @DisplayName("Should close a long with a reducing SELL")
    void testCloseLong() {
        when(venueClient.placeMarketOrder(SYMBOL, OrderSide.SELL, TradingDirection.LONG, QTY, true)).thenReturn(ok(OrderSide.SELL));

        assertTrue(orderService.close(SYMBOL, TradingDirection.LONG, QTY).isSuccess());
    }

    @Test
    @DisplayName("Should close a short with a reducing BUY")
    void testCloseShort() {
        when(venueClient.placeMarketOrder(SYMBOL, OrderSide.BUY, TradingDirection.SHORT, QTY, true)).thenReturn(ok(OrderSide.BUY));

        assertTrue(orderService.close(SYMBOL, TradingDirection.SHORT, QTY).isSuccess());
    }

    @Test
    @DisplayName("Should pass a venue rejection through")
    void testVenueRejection() {
        // Given
        when(venueClient.placeMarketOrder(anyString(), any(), any(), any(), anyBoolean()))
                .thenReturn(OrderResult.failed(SYMBOL, OrderSide.BUY, QTY, "Margin is insufficient."));

        // When
        OrderResult result = orderService.open(SYMBOL, TradingDirection.LONG, QTY);

        // Then
        assertFalse(result.isSuccess());
        assertEquals("Margin is insufficient.", result.getMessage());
    }

    @Test
    @DisplayName("Should not call the venue for a zero quantity")
    void testZeroQuantity() {
        assertFalse(orderService.close(SYMBOL, TradingDirection.LONG, BigDecimal.ZERO).isSuccess());
        verifyNoInteractions(venueClient);
    }

    @Test
    @DisplayName("Should reject FLAT as an order direction")
    void testFlatRejected() {
        assertThrows(IllegalArgumentException.class, () -> orderService.open(SYMBOL, TradingDirection.FLAT, QTY));
        assertThrows(IllegalArgumentException.class, () -> orderService.close(SYMBOL, TradingDirection.FLAT, QTY));
    }
}
