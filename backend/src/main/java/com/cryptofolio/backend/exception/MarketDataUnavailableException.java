package com.cryptofolio.backend.exception;

public class MarketDataUnavailableException extends MarketDataException {
    public MarketDataUnavailableException(String message, Throwable cause) {
        super(message, 503, cause);
    }
}
