package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InsufficientHistoryException;
import com.cryptofolio.backend.exception.InvalidPriceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Tracks per-asset unit holdings of a portfolio through an aligned price history.
 *
 * <p>Capital is normalized to 1.0 and split by the target weights at the first timestamp. On an
 * ordinary step the holdings are carried over and the value drifts with prices. On a scheduled
 * boundary the value is first marked to the new prices and then redistributed to the target
 * weights, so value is unchanged at the instant of rebalancing (no costs are modelled).
 */
@Slf4j
public class RebalancingSimulator {

    private final AllocationValidator allocationValidator;
    private final RebalanceSchedule rebalanceSchedule;

    public RebalancingSimulator() {
        this(new AllocationValidator(), new RebalanceSchedule());
    }

    public RebalancingSimulator(AllocationValidator allocationValidator, RebalanceSchedule rebalanceSchedule) {
        this.allocationValidator = allocationValidator;
        this.rebalanceSchedule = rebalanceSchedule;
    }

    public SimulationResult simulate(AlignedPriceTable prices, WeightVector weights, RebalancingFrequency frequency) {
        Objects.requireNonNull(frequency, "frequency");
        allocationValidator.validate(weights, prices.assetCount());
        if (prices.size() < 1) {
            throw new InsufficientHistoryException(prices.size(), 1);
        }

        int rows = prices.size();
        int assets = prices.assetCount();
        boolean[] boundaries = rebalanceSchedule.boundaries(prices.timestamps(), frequency);
        double[] values = new double[rows];
        double[][] quantitySeries = new double[rows][];
        List<Instant> rebalances = new ArrayList<>();

        double[] quantities = new double[assets];
        double[] current = checkedPrices(prices, 0);
        for (int asset = 0; asset < assets; asset++) {
            quantities[asset] = weights.get(asset) / current[asset];
        }
        values[0] = 1.0;
        quantitySeries[0] = quantities.clone();

        for (int row = 1; row < rows; row++) {
            current = checkedPrices(prices, row);
            double value = 0.0;
            for (int asset = 0; asset < assets; asset++) {
                value += quantities[asset] * current[asset];
            }
            if (boundaries[row]) {
                for (int asset = 0; asset < assets; asset++) {
                    quantities[asset] = value * weights.get(asset) / current[asset];
                }
                rebalances.add(prices.timestamp(row));
            }
            values[row] = value;
            quantitySeries[row] = quantities.clone();
        }

        log.debug("Simulation complete assets={} rows={} frequency={} rebalances={} finalValue={}",
                prices.assetIds(), rows, frequency, rebalances.size(), values[rows - 1]);
        return new SimulationResult(prices, values, quantitySeries, rebalances, frequency);
    }

    private double[] checkedPrices(AlignedPriceTable prices, int row) {
        double[] current = prices.row(row);
        for (int asset = 0; asset < current.length; asset++) {
            if (!(current[asset] > 0) || Double.isInfinite(current[asset])) {
                throw new InvalidPriceException(prices.assetIds().get(asset), prices.timestamp(row), current[asset]);
            }
        }
        return current;
    }
}
