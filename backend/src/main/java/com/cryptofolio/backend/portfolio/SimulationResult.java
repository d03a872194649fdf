package com.cryptofolio.backend.portfolio;

import java.time.Instant;
import java.util.List;

/**
 * Output of one rebalancing simulation: the normalized portfolio value and the per-asset unit
 * holdings at every timestamp of the aligned table it was run on.
 */
public final class SimulationResult {

    private final List<String> assetIds;
    private final Instant[] timestamps;
    private final double[][] prices;
    private final double[] values;
    private final double[][] quantities;
    private final List<Instant> rebalanceTimestamps;
    private final RebalancingFrequency frequency;

    SimulationResult(AlignedPriceTable table,
                     double[] values,
                     double[][] quantities,
                     List<Instant> rebalanceTimestamps,
                     RebalancingFrequency frequency) {
        this.assetIds = table.assetIds();
        this.timestamps = table.timestamps().toArray(new Instant[0]);
        this.prices = new double[table.size()][];
        for (int row = 0; row < table.size(); row++) {
            this.prices[row] = table.row(row);
        }
        this.values = values;
        this.quantities = quantities;
        this.rebalanceTimestamps = List.copyOf(rebalanceTimestamps);
        this.frequency = frequency;
    }

    public List<String> assetIds() {
        return assetIds;
    }

    public RebalancingFrequency frequency() {
        return frequency;
    }

    public int size() {
        return values.length;
    }

    public Instant timestamp(int row) {
        return timestamps[row];
    }

    public List<Instant> timestamps() {
        return List.of(timestamps);
    }

    public double value(int row) {
        return values[row];
    }

    public double[] values() {
        return values.clone();
    }

    public double finalValue() {
        return values[values.length - 1];
    }

    public double quantity(int row, int asset) {
        return quantities[row][asset];
    }

    public double[] quantitiesAt(int row) {
        return quantities[row].clone();
    }

    public List<Instant> rebalanceTimestamps() {
        return rebalanceTimestamps;
    }

    /**
     * Dollar-weighted allocation implied by the holdings and prices at {@code row}.
     */
    public double[] allocationAt(int row) {
        double[] allocation = new double[assetIds.size()];
        for (int asset = 0; asset < allocation.length; asset++) {
            allocation[asset] = quantities[row][asset] * prices[row][asset] / values[row];
        }
        return allocation;
    }

    public double[] finalAllocation() {
        return allocationAt(values.length - 1);
    }

    /**
     * Change of an asset's unit holding between the first and last timestamp, in percent.
     * An asset that started with no units reports 0.
     */
    public double quantityDriftPct(int asset) {
        double initial = quantities[0][asset];
        if (initial == 0.0) {
            return 0.0;
        }
        double last = quantities[quantities.length - 1][asset];
        return (last - initial) / initial * 100.0;
    }

    public double totalReturnPct() {
        return (finalValue() - values[0]) / values[0] * 100.0;
    }

    public double maxDrawdown() {
        return DrawdownCalculator.maxDrawdown(values);
    }
}
