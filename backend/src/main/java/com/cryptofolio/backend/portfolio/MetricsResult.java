package com.cryptofolio.backend.portfolio;

/**
 * Risk/return summary of one weighted portfolio over an aligned price history.
 *
 * @param annualizedReturnPct     weighted mean daily log return, annualized, in percent
 * @param annualizedVolatilityPct sqrt(w' Σ w) of the annualized covariance, in percent
 * @param sharpeRatio             (return - risk free) / volatility, 0 when volatility is 0
 * @param correlation             Pearson correlation of daily log returns
 * @param maxDrawdown             most negative peak-to-trough fraction, in [-1, 0]
 */
public record MetricsResult(
        double annualizedReturnPct,
        double annualizedVolatilityPct,
        double sharpeRatio,
        CorrelationMatrix correlation,
        double maxDrawdown
) {}
