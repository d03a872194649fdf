package com.cryptofolio.backend.service;

import com.cryptofolio.backend.config.AnalyticsProperties;
import com.cryptofolio.backend.dto.PortfolioRequest;
import com.cryptofolio.backend.exception.DimensionMismatchException;
import com.cryptofolio.backend.exception.InsufficientHistoryException;
import com.cryptofolio.backend.exception.InvalidWeightsException;
import com.cryptofolio.backend.marketdata.MarketDataProvider;
import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.AllocationValidator;
import com.cryptofolio.backend.portfolio.RebalancingFrequency;
import com.cryptofolio.backend.portfolio.RebalancingSimulator;
import com.cryptofolio.backend.portfolio.ReturnCalculator;
import com.cryptofolio.backend.portfolio.RiskMetricsEngine;
import com.cryptofolio.backend.portfolio.SimulationResult;
import com.cryptofolio.backend.portfolio.WeightVector;
import com.cryptofolio.backend.service.PortfolioAnalysisService.MetricsReport;
import com.cryptofolio.backend.service.PortfolioAnalysisService.PortfolioAnalysis;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PortfolioAnalysisServiceTest {

    private static final Instant DAY0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final List<String> ASSETS = List.of("bitcoin", "ethereum");

    private final MarketDataProvider marketDataProvider = mock(MarketDataProvider.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final AnalyticsProperties analyticsProperties = new AnalyticsProperties();
    private PortfolioAnalysisService service;

    @BeforeEach
    void setUp() {
        AllocationValidator validator = new AllocationValidator();
        ReturnCalculator returnCalculator = new ReturnCalculator();
        service = new PortfolioAnalysisService(
                marketDataProvider,
                validator,
                new RiskMetricsEngine(validator, returnCalculator, 365),
                new RebalancingSimulator(),
                returnCalculator,
                analyticsProperties,
                meterRegistry);
    }

    @Test
    void invalidWeightsNeverReachMarketData() {
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(0.5, 0.6), null, 30, null);

        assertThatThrownBy(() -> service.computeMetrics(request)).isInstanceOf(InvalidWeightsException.class);
        verifyNoInteractions(marketDataProvider);
    }

    @Test
    void weightCountMustMatchAssets() {
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(1.0), null, 30, null);

        assertThatThrownBy(() -> service.simulate(request)).isInstanceOf(DimensionMismatchException.class);
        verifyNoInteractions(marketDataProvider);
    }

    @Test
    void omittedLookbackAndRiskFreeRateUseConfiguredDefaults() {
        when(marketDataProvider.fetchAlignedSeries(ASSETS, 365)).thenReturn(table());
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(0.5, 0.5), null, null, null);

        MetricsReport report = service.computeMetrics(request);

        verify(marketDataProvider).fetchAlignedSeries(ASSETS, 365);
        MetricsReport explicit = service.computeMetrics(table(), WeightVector.of(0.5, 0.5), 0.02);
        assertThat(report.metrics()).isEqualTo(explicit.metrics());
        assertThat(report.assets()).hasSize(2);
        assertThat(meterRegistry.get("portfolio_metrics_latency").timer().count()).isEqualTo(2);
    }

    @Test
    void omittedFrequencyMeansBuyAndHold() {
        when(marketDataProvider.fetchAlignedSeries(ASSETS, 30)).thenReturn(table());
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(0.5, 0.5), null, 30, null);

        SimulationResult result = service.simulate(request);

        assertThat(result.frequency()).isEqualTo(RebalancingFrequency.NONE);
        assertThat(result.rebalanceTimestamps()).isEmpty();
    }

    @Test
    void analysisCombinesMetricsSimulationAndGrowth() {
        when(marketDataProvider.fetchAlignedSeries(ASSETS, 30)).thenReturn(table());
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(0.5, 0.5), RebalancingFrequency.WEEKLY, 30, 0.01);

        PortfolioAnalysis analysis = service.analyze(request);

        assertThat(analysis.metrics().prices().size()).isEqualTo(10);
        assertThat(analysis.simulation().rebalanceTimestamps()).containsExactly(DAY0.plus(7, ChronoUnit.DAYS));
        assertThat(analysis.individualGrowth()[0]).containsExactly(1.0, 1.0);
        assertThat(analysis.individualGrowth()[9][0]).isCloseTo(1.9, offset(1e-12));
        verify(marketDataProvider).fetchAlignedSeries(ASSETS, 30);
    }

    @Test
    void simulationNeedsAtLeastTwoAlignedTimestamps() {
        AlignedPriceTable oneRow = AlignedPriceTable.builder(ASSETS).row(DAY0, 100.0, 10.0).build();
        when(marketDataProvider.fetchAlignedSeries(ASSETS, 30)).thenReturn(oneRow);
        PortfolioRequest request = new PortfolioRequest(ASSETS, List.of(0.5, 0.5), RebalancingFrequency.DAILY, 30, null);

        assertThatThrownBy(() -> service.simulate(request))
                .isInstanceOf(InsufficientHistoryException.class)
                .hasMessageContaining("got 1");
        assertThat(meterRegistry.find("portfolio_simulation_latency").timer()).isNull();
    }

    private static AlignedPriceTable table() {
        AlignedPriceTable.Builder builder = AlignedPriceTable.builder(ASSETS);
        double[] eth = {10, 11, 10.5, 12, 11.5, 11, 12.5, 13, 12, 12.5};
        for (int i = 0; i < 10; i++) {
            builder.row(DAY0.plus(i, ChronoUnit.DAYS), 100.0 + 10.0 * i, eth[i]);
        }
        return builder.build();
    }
}
