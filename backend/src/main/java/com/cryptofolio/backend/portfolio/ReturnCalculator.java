package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InsufficientHistoryException;
import com.cryptofolio.backend.exception.InvalidPriceException;

import java.time.Instant;

public class ReturnCalculator {

    /**
     * r(t) = ln(P(t) / P(t-1)) per asset; M aligned rows give M-1 return rows.
     */
    public LogReturnTable logReturns(AlignedPriceTable table) {
        if (table.size() < 2) {
            throw new InsufficientHistoryException(table.size(), 2);
        }
        int assets = table.assetCount();
        Instant[] timestamps = new Instant[table.size() - 1];
        double[][] returns = new double[table.size() - 1][assets];
        double[] previous = checkedRow(table, 0);
        for (int row = 1; row < table.size(); row++) {
            double[] current = checkedRow(table, row);
            for (int asset = 0; asset < assets; asset++) {
                returns[row - 1][asset] = Math.log(current[asset] / previous[asset]);
            }
            timestamps[row - 1] = table.timestamp(row);
            previous = current;
        }
        return new LogReturnTable(table.assetIds(), timestamps, returns);
    }

    /**
     * Growth of one unit invested in each asset at the first timestamp: P(t) / P(t0).
     */
    public double[][] cumulativeGrowth(AlignedPriceTable table) {
        double[] base = checkedRow(table, 0);
        double[][] growth = new double[table.size()][table.assetCount()];
        for (int row = 0; row < table.size(); row++) {
            double[] current = checkedRow(table, row);
            for (int asset = 0; asset < current.length; asset++) {
                growth[row][asset] = current[asset] / base[asset];
            }
        }
        return growth;
    }

    private double[] checkedRow(AlignedPriceTable table, int row) {
        double[] prices = table.row(row);
        for (int asset = 0; asset < prices.length; asset++) {
            if (!(prices[asset] > 0) || Double.isInfinite(prices[asset])) {
                throw new InvalidPriceException(table.assetIds().get(asset), table.timestamp(row), prices[asset]);
            }
        }
        return prices;
    }
}
