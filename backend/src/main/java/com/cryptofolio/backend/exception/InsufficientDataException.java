package com.cryptofolio.backend.exception;

public class InsufficientDataException extends PortfolioAnalyticsException {
    public InsufficientDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
