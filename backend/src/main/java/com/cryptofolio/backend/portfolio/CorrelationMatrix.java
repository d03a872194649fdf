package com.cryptofolio.backend.portfolio;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Symmetric asset-by-asset Pearson correlation of daily log returns. The diagonal is exactly
 * 1.0; a pair involving a constant series has no defined correlation and is stored as 0.
 */
public final class CorrelationMatrix {

    private final List<String> assetIds;
    private final double[][] values;

    public CorrelationMatrix(List<String> assetIds, double[][] values) {
        Objects.requireNonNull(assetIds, "assetIds");
        Objects.requireNonNull(values, "values");
        if (values.length != assetIds.size()) {
            throw new IllegalArgumentException("Matrix size does not match asset count");
        }
        this.assetIds = List.copyOf(assetIds);
        this.values = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            this.values[i] = values[i].clone();
        }
    }

    public List<String> assetIds() {
        return assetIds;
    }

    public int size() {
        return assetIds.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double[][] values() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CorrelationMatrix other)) {
            return false;
        }
        return assetIds.equals(other.assetIds) && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * assetIds.hashCode() + Arrays.deepHashCode(values);
    }

    @Override
    public String toString() {
        return "CorrelationMatrix{assets=" + assetIds + ", values=" + Arrays.deepToString(values) + "}";
    }
}
