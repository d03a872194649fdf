package com.cryptofolio.backend.exception;

public class DimensionMismatchException extends PortfolioAnalyticsException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("DIMENSION_MISMATCH", "Expected " + expected + " weights (one per asset), got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
