package com.cryptofolio.backend.service;

import com.cryptofolio.backend.config.AnalyticsProperties;
import com.cryptofolio.backend.dto.PortfolioRequest;
import com.cryptofolio.backend.exception.InsufficientHistoryException;
import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.AllocationValidator;
import com.cryptofolio.backend.portfolio.AssetStatistics;
import com.cryptofolio.backend.portfolio.MetricsResult;
import com.cryptofolio.backend.portfolio.RebalancingFrequency;
import com.cryptofolio.backend.portfolio.RebalancingSimulator;
import com.cryptofolio.backend.portfolio.ReturnCalculator;
import com.cryptofolio.backend.portfolio.RiskMetricsEngine;
import com.cryptofolio.backend.portfolio.SimulationResult;
import com.cryptofolio.backend.portfolio.WeightVector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Turns portfolio requests into engine calls. Weights are checked before any market data is
 * requested, so a malformed allocation never costs an upstream call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioAnalysisService {

    private final MarketDataProvider marketDataProvider;
    private final AllocationValidator allocationValidator;
    private final RiskMetricsEngine riskMetricsEngine;
    private final RebalancingSimulator rebalancingSimulator;
    private final ReturnCalculator returnCalculator;
    private final AnalyticsProperties analyticsProperties;
    private final MeterRegistry meterRegistry;

    public MetricsReport computeMetrics(PortfolioRequest request) {
        WeightVector weights = checkedWeights(request);
        AlignedPriceTable prices = fetch(request);
        return computeMetrics(prices, weights, riskFreeRate(request));
    }

    public MetricsReport computeMetrics(AlignedPriceTable prices, WeightVector weights, double riskFreeRate) {
        MetricsResult metrics = Timer.builder("portfolio_metrics_latency").register(meterRegistry)
                .record(() -> riskMetricsEngine.computeMetrics(prices, weights, riskFreeRate));
        List<AssetStatistics> assets = riskMetricsEngine.assetStatistics(prices);
        log.info("Metrics computed assets={} rows={} returnPct={} volatilityPct={} sharpe={}",
                prices.assetIds(), prices.size(), metrics.annualizedReturnPct(),
                metrics.annualizedVolatilityPct(), metrics.sharpeRatio());
        return new MetricsReport(prices, metrics, assets);
    }

    public SimulationResult simulate(PortfolioRequest request) {
        WeightVector weights = checkedWeights(request);
        AlignedPriceTable prices = fetch(request);
        return simulate(prices, weights, frequency(request));
    }

    public SimulationResult simulate(AlignedPriceTable prices, WeightVector weights, RebalancingFrequency frequency) {
        SimulationResult result = Timer.builder("portfolio_simulation_latency")
                .tag("frequency", frequency.name())
                .register(meterRegistry)
                .record(() -> rebalancingSimulator.simulate(prices, weights, frequency));
        log.info("Simulation computed assets={} rows={} frequency={} rebalances={} finalValue={}",
                prices.assetIds(), prices.size(), frequency, result.rebalanceTimestamps().size(), result.finalValue());
        return result;
    }

    public PortfolioAnalysis analyze(PortfolioRequest request) {
        WeightVector weights = checkedWeights(request);
        AlignedPriceTable prices = fetch(request);
        MetricsReport report = computeMetrics(prices, weights, riskFreeRate(request));
        SimulationResult simulation = simulate(prices, weights, frequency(request));
        return new PortfolioAnalysis(report, simulation, returnCalculator.cumulativeGrowth(prices));
    }

    private WeightVector checkedWeights(PortfolioRequest request) {
        WeightVector weights = WeightVector.of(request.weights());
        allocationValidator.validate(weights, request.assetIds().size());
        return weights;
    }

    private AlignedPriceTable fetch(PortfolioRequest request) {
        int lookbackDays = request.lookbackDays() == null
                ? analyticsProperties.getDefaultLookbackDays()
                : request.lookbackDays();
        AlignedPriceTable prices = marketDataProvider.fetchAlignedSeries(request.assetIds(), lookbackDays);
        if (prices.size() < 2) {
            log.warn("Only {} aligned timestamps for {} over {} days", prices.size(), request.assetIds(), lookbackDays);
            throw new InsufficientHistoryException(prices.size(), 2);
        }
        return prices;
    }

    private double riskFreeRate(PortfolioRequest request) {
        return request.riskFreeRate() == null ? analyticsProperties.getDefaultRiskFreeRate() : request.riskFreeRate();
    }

    private RebalancingFrequency frequency(PortfolioRequest request) {
        return request.frequency() == null ? RebalancingFrequency.NONE : request.frequency();
    }

    public record MetricsReport(
            AlignedPriceTable prices,
            MetricsResult metrics,
            List<AssetStatistics> assets
    ) {}

    public record PortfolioAnalysis(
            MetricsReport metrics,
            SimulationResult simulation,
            double[][] individualGrowth
    ) {}
}
