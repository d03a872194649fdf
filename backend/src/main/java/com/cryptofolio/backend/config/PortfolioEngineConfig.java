package com.cryptofolio.backend.config;

import com.cryptofolio.backend.portfolio.AllocationValidator;
import com.cryptofolio.backend.portfolio.PriceAligner;
import com.cryptofolio.backend.portfolio.RebalanceSchedule;
import com.cryptofolio.backend.portfolio.RebalancingSimulator;
import com.cryptofolio.backend.portfolio.ReturnCalculator;
import com.cryptofolio.backend.portfolio.RiskMetricsEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The portfolio engines are plain classes; this wires them from {@link AnalyticsProperties}.
 */
@Configuration
public class PortfolioEngineConfig {

    @Bean
    public AllocationValidator allocationValidator(AnalyticsProperties properties) {
        return new AllocationValidator(properties.getWeightTolerance());
    }

    @Bean
    public PriceAligner priceAligner() {
        return new PriceAligner();
    }

    @Bean
    public ReturnCalculator returnCalculator() {
        return new ReturnCalculator();
    }

    @Bean
    public RebalanceSchedule rebalanceSchedule(AnalyticsProperties properties) {
        return new RebalanceSchedule(ZoneId.of(properties.getZone()), properties.getWeeklyBoundary());
    }

    @Bean
    public RiskMetricsEngine riskMetricsEngine(AllocationValidator allocationValidator,
                                               ReturnCalculator returnCalculator,
                                               AnalyticsProperties properties) {
        return new RiskMetricsEngine(allocationValidator, returnCalculator, properties.getAnnualizationFactor());
    }

    @Bean
    public RebalancingSimulator rebalancingSimulator(AllocationValidator allocationValidator,
                                                     RebalanceSchedule rebalanceSchedule) {
        return new RebalancingSimulator(allocationValidator, rebalanceSchedule);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
