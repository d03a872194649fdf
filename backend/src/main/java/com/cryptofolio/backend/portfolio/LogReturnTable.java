package com.cryptofolio.backend.portfolio;

import java.time.Instant;
import java.util.List;

/**
 * Daily logarithmic returns, one row per adjacent pair of aligned timestamps. Row {@code t}
 * is stamped with the later timestamp of its pair.
 */
public final class LogReturnTable {

    private final List<String> assetIds;
    private final Instant[] timestamps;
    private final double[][] returns;

    LogReturnTable(List<String> assetIds, Instant[] timestamps, double[][] returns) {
        this.assetIds = List.copyOf(assetIds);
        this.timestamps = timestamps;
        this.returns = returns;
    }

    public List<String> assetIds() {
        return assetIds;
    }

    public int assetCount() {
        return assetIds.size();
    }

    public int size() {
        return returns.length;
    }

    public Instant timestamp(int row) {
        return timestamps[row];
    }

    public double get(int row, int asset) {
        return returns[row][asset];
    }

    public double[] row(int row) {
        return returns[row].clone();
    }

    public double[] column(int asset) {
        double[] column = new double[returns.length];
        for (int row = 0; row < returns.length; row++) {
            column[row] = returns[row][asset];
        }
        return column;
    }

    /**
     * Weighted sum of the asset returns on each row.
     */
    public double[] weighted(WeightVector weights) {
        double[] combined = new double[returns.length];
        for (int row = 0; row < returns.length; row++) {
            double sum = 0.0;
            for (int asset = 0; asset < assetIds.size(); asset++) {
                sum += weights.get(asset) * returns[row][asset];
            }
            combined[row] = sum;
        }
        return combined;
    }
}
