package io.signalbot.binance;

public class VenueException extends RuntimeException {

    public VenueException(String message, Throwable cause) {
        super(message, cause);
    }
}
