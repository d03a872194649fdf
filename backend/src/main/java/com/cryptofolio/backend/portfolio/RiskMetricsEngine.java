package com.cryptofolio.backend.portfolio;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Annualized return, covariance-based volatility, Sharpe ratio, correlation and drawdown of a
 * weighted portfolio. Annualization uses calendar days (365) because crypto markets never close.
 * Stateless: identical inputs always produce identical results.
 */
@Slf4j
public class RiskMetricsEngine {

    public static final int DEFAULT_ANNUALIZATION_FACTOR = 365;

    private final AllocationValidator allocationValidator;
    private final ReturnCalculator returnCalculator;
    private final int annualizationFactor;

    public RiskMetricsEngine() {
        this(new AllocationValidator(), new ReturnCalculator(), DEFAULT_ANNUALIZATION_FACTOR);
    }

    public RiskMetricsEngine(AllocationValidator allocationValidator,
                             ReturnCalculator returnCalculator,
                             int annualizationFactor) {
        if (annualizationFactor < 1) {
            throw new IllegalArgumentException("annualizationFactor must be positive: " + annualizationFactor);
        }
        this.allocationValidator = allocationValidator;
        this.returnCalculator = returnCalculator;
        this.annualizationFactor = annualizationFactor;
    }

    public MetricsResult computeMetrics(AlignedPriceTable prices, WeightVector weights, double riskFreeRateAnnual) {
        if (!Double.isFinite(riskFreeRateAnnual)) {
            throw new IllegalArgumentException("Risk-free rate must be finite: " + riskFreeRateAnnual);
        }
        allocationValidator.validate(weights, prices.assetCount());
        LogReturnTable returns = returnCalculator.logReturns(prices);

        double[] annualReturns = annualizedMeans(returns);
        double portfolioReturn = 0.0;
        for (int asset = 0; asset < annualReturns.length; asset++) {
            portfolioReturn += weights.get(asset) * annualReturns[asset];
        }

        double[][] covariance = annualizedCovariance(returns);
        double variance = 0.0;
        for (int i = 0; i < covariance.length; i++) {
            for (int j = 0; j < covariance.length; j++) {
                variance += weights.get(i) * covariance[i][j] * weights.get(j);
            }
        }
        // a PSD quadratic form can still round to a tiny negative
        double volatility = Math.sqrt(Math.max(0.0, variance));
        double sharpe = volatility == 0.0 ? 0.0 : (portfolioReturn - riskFreeRateAnnual) / volatility;

        CorrelationMatrix correlation = correlation(returns, covariance);
        double maxDrawdown = DrawdownCalculator.maxDrawdown(cumulativeValue(returns.weighted(weights)));

        log.debug("Metrics assets={} rows={} return={} volatility={} sharpe={} maxDrawdown={}",
                prices.assetIds(), prices.size(), portfolioReturn, volatility, sharpe, maxDrawdown);
        return new MetricsResult(
                portfolioReturn * 100.0,
                volatility * 100.0,
                sharpe,
                correlation,
                maxDrawdown
        );
    }

    public List<AssetStatistics> assetStatistics(AlignedPriceTable prices) {
        LogReturnTable returns = returnCalculator.logReturns(prices);
        double[] annualReturns = annualizedMeans(returns);
        double[][] covariance = annualizedCovariance(returns);
        List<AssetStatistics> statistics = new ArrayList<>(returns.assetCount());
        for (int asset = 0; asset < returns.assetCount(); asset++) {
            statistics.add(new AssetStatistics(
                    returns.assetIds().get(asset),
                    annualReturns[asset] * 100.0,
                    Math.sqrt(Math.max(0.0, covariance[asset][asset])) * 100.0
            ));
        }
        return statistics;
    }

    public CorrelationMatrix correlation(AlignedPriceTable prices) {
        LogReturnTable returns = returnCalculator.logReturns(prices);
        return correlation(returns, annualizedCovariance(returns));
    }

    /**
     * Sample covariance of the daily log returns (n - 1 divisor) scaled to a year. A single
     * return row carries no dispersion, so its covariance is 0.
     */
    double[][] annualizedCovariance(LogReturnTable returns) {
        int assets = returns.assetCount();
        int rows = returns.size();
        double[] means = means(returns);
        double[][] covariance = new double[assets][assets];
        double divisor = Math.max(1, rows - 1);
        for (int i = 0; i < assets; i++) {
            for (int j = i; j < assets; j++) {
                double sum = 0.0;
                for (int row = 0; row < rows; row++) {
                    sum += (returns.get(row, i) - means[i]) * (returns.get(row, j) - means[j]);
                }
                double value = sum / divisor * annualizationFactor;
                covariance[i][j] = value;
                covariance[j][i] = value;
            }
        }
        return covariance;
    }

    private CorrelationMatrix correlation(LogReturnTable returns, double[][] covariance) {
        int assets = returns.assetCount();
        double[][] matrix = new double[assets][assets];
        for (int i = 0; i < assets; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < assets; j++) {
                double value = 0.0;
                if (covariance[i][i] > 0 && covariance[j][j] > 0) {
                    value = covariance[i][j] / Math.sqrt(covariance[i][i] * covariance[j][j]);
                    value = Math.max(-1.0, Math.min(1.0, value));
                }
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }
        return new CorrelationMatrix(returns.assetIds(), matrix);
    }

    private double[] annualizedMeans(LogReturnTable returns) {
        double[] means = means(returns);
        for (int asset = 0; asset < means.length; asset++) {
            means[asset] *= annualizationFactor;
        }
        return means;
    }

    private double[] means(LogReturnTable returns) {
        double[] means = new double[returns.assetCount()];
        for (int row = 0; row < returns.size(); row++) {
            for (int asset = 0; asset < means.length; asset++) {
                means[asset] += returns.get(row, asset);
            }
        }
        for (int asset = 0; asset < means.length; asset++) {
            means[asset] /= returns.size();
        }
        return means;
    }

    /**
     * exp(cumulative sum of log returns), starting from 1.0 at the first aligned timestamp.
     */
    static double[] cumulativeValue(double[] logReturns) {
        double[] values = new double[logReturns.length + 1];
        values[0] = 1.0;
        double cumulative = 0.0;
        for (int i = 0; i < logReturns.length; i++) {
            cumulative += logReturns[i];
            values[i + 1] = Math.exp(cumulative);
        }
        return values;
    }
}
