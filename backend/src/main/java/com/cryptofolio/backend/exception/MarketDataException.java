package com.cryptofolio.backend.exception;

public class MarketDataException extends RuntimeException {
    private final int statusCode;

    public MarketDataException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public MarketDataException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
