package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InvalidPriceException;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Historical prices of one asset, keyed by timestamp in ascending order.
 * Every price is finite and strictly positive.
 */
public record PriceSeries(String assetId, NavigableMap<Instant, Double> prices) {

    public PriceSeries {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId is required");
        }
        TreeMap<Instant, Double> copy = new TreeMap<>();
        if (prices != null) {
            for (Map.Entry<Instant, Double> entry : prices.entrySet()) {
                Objects.requireNonNull(entry.getKey(), "timestamp");
                Double price = entry.getValue();
                if (price == null || !Double.isFinite(price) || price <= 0) {
                    throw new InvalidPriceException(assetId, entry.getKey(), price == null ? Double.NaN : price);
                }
                copy.put(entry.getKey(), price);
            }
        }
        prices = Collections.unmodifiableNavigableMap(copy);
    }

    public static PriceSeries of(String assetId, Map<Instant, Double> prices) {
        return new PriceSeries(assetId, prices == null ? null : new TreeMap<>(prices));
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public int size() {
        return prices.size();
    }
}
