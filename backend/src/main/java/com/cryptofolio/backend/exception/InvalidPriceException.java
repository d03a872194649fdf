package com.cryptofolio.backend.exception;

import java.time.Instant;

public class InvalidPriceException extends PortfolioAnalyticsException {

    private final String assetId;
    private final Instant timestamp;
    private final double price;

    public InvalidPriceException(String assetId, Instant timestamp, double price) {
        super("INVALID_PRICE", "Non-positive price " + price + " for " + assetId + " at " + timestamp);
        this.assetId = assetId;
        this.timestamp = timestamp;
        this.price = price;
    }

    public String getAssetId() {
        return assetId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPrice() {
        return price;
    }
}
