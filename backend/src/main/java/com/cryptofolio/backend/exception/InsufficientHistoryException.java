package com.cryptofolio.backend.exception;

public class InsufficientHistoryException extends PortfolioAnalyticsException {

    private final int available;
    private final int required;

    public InsufficientHistoryException(int available, int required) {
        super("INSUFFICIENT_HISTORY",
                "At least " + required + " aligned timestamps required, got " + available);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
