package com.cryptofolio.backend.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Metrics, simulated portfolio and each asset's own growth of 1.0, for side-by-side charting.
 */
public record AnalysisResponse(
        MetricsResponse metrics,
        SimulationResponse simulation,
        List<GrowthPoint> individualGrowth
) {

    public record GrowthPoint(Instant timestamp, Map<String, Double> growth) {}
}
