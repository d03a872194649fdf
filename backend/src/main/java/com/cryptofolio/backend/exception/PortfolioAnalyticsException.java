package com.cryptofolio.backend.exception;

/**
 * Base type for data problems detected by the portfolio core. Each subtype maps to one
 * stable error code so callers can branch without parsing messages.
 */
public abstract class PortfolioAnalyticsException extends RuntimeException {

    private final String errorCode;

    protected PortfolioAnalyticsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
