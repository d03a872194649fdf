package com.cryptofolio.backend.exception;

public class MarketDataRateLimitException extends MarketDataException {
    public MarketDataRateLimitException(String message) {
        super(message, 429, null);
    }

    public MarketDataRateLimitException(String message, Throwable cause) {
        super(message, 429, cause);
    }
}
