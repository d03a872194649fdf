package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InsufficientDataException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Prices of a fixed, ordered set of assets sampled on a common, gap-free timestamp index.
 * Rows are timestamps in strictly increasing order, columns follow {@link #assetIds()}.
 * Instances are immutable; every accessor returns a copy of the backing arrays.
 */
public final class AlignedPriceTable {

    private final List<String> assetIds;
    private final Instant[] timestamps;
    private final double[][] prices;

    public AlignedPriceTable(List<String> assetIds, List<Instant> timestamps, double[][] prices) {
        Objects.requireNonNull(assetIds, "assetIds");
        Objects.requireNonNull(timestamps, "timestamps");
        Objects.requireNonNull(prices, "prices");
        if (assetIds.isEmpty()) {
            throw new InsufficientDataException("Aligned price table needs at least one asset");
        }
        if (new HashSet<>(assetIds).size() != assetIds.size()) {
            throw new IllegalArgumentException("Asset ids must be unique: " + assetIds);
        }
        if (timestamps.isEmpty()) {
            throw new InsufficientDataException("Aligned price table has no timestamps");
        }
        if (prices.length != timestamps.size()) {
            throw new IllegalArgumentException("Expected " + timestamps.size() + " price rows, got " + prices.length);
        }
        this.assetIds = List.copyOf(assetIds);
        this.timestamps = timestamps.toArray(new Instant[0]);
        this.prices = new double[prices.length][];
        for (int row = 0; row < prices.length; row++) {
            if (row > 0 && !this.timestamps[row].isAfter(this.timestamps[row - 1])) {
                throw new IllegalArgumentException("Timestamps must be strictly increasing at row " + row);
            }
            if (prices[row] == null || prices[row].length != assetIds.size()) {
                throw new IllegalArgumentException("Row " + row + " must hold " + assetIds.size() + " prices");
            }
            this.prices[row] = prices[row].clone();
        }
    }

    public static Builder builder(String... assetIds) {
        return new Builder(List.of(assetIds));
    }

    public static Builder builder(List<String> assetIds) {
        return new Builder(assetIds);
    }

    public List<String> assetIds() {
        return assetIds;
    }

    public int assetCount() {
        return assetIds.size();
    }

    public int size() {
        return timestamps.length;
    }

    public int indexOf(String assetId) {
        return assetIds.indexOf(assetId);
    }

    public Instant timestamp(int row) {
        return timestamps[row];
    }

    public List<Instant> timestamps() {
        return List.of(timestamps);
    }

    public Instant firstTimestamp() {
        return timestamps[0];
    }

    public Instant lastTimestamp() {
        return timestamps[timestamps.length - 1];
    }

    public double price(int row, int asset) {
        return prices[row][asset];
    }

    public double[] row(int row) {
        return prices[row].clone();
    }

    public double[] column(int asset) {
        double[] column = new double[prices.length];
        for (int row = 0; row < prices.length; row++) {
            column[row] = prices[row][asset];
        }
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AlignedPriceTable other)) {
            return false;
        }
        return assetIds.equals(other.assetIds)
                && Arrays.equals(timestamps, other.timestamps)
                && Arrays.deepEquals(prices, other.prices);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(assetIds);
        result = 31 * result + Arrays.hashCode(timestamps);
        result = 31 * result + Arrays.deepHashCode(prices);
        return result;
    }

    @Override
    public String toString() {
        return "AlignedPriceTable{assets=" + assetIds + ", rows=" + timestamps.length
                + ", from=" + timestamps[0] + ", to=" + timestamps[timestamps.length - 1] + "}";
    }

    public static final class Builder {
        private final List<String> assetIds;
        private final List<Instant> timestamps = new ArrayList<>();
        private final List<double[]> rows = new ArrayList<>();

        private Builder(List<String> assetIds) {
            this.assetIds = List.copyOf(assetIds);
        }

        public Builder row(Instant timestamp, double... prices) {
            timestamps.add(timestamp);
            rows.add(prices.clone());
            return this;
        }

        public AlignedPriceTable build() {
            return new AlignedPriceTable(assetIds, timestamps, rows.toArray(new double[0][]));
        }
    }
}
