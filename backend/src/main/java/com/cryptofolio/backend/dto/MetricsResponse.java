package com.cryptofolio.backend.dto;

import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.AssetStatistics;
import com.cryptofolio.backend.portfolio.MetricsResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public record MetricsResponse(
        List<String> assetIds,
        Instant from,
        Instant to,
        int observations,
        double annualizedReturnPct,
        double annualizedVolatilityPct,
        double sharpeRatio,
        double maxDrawdown,
        List<List<Double>> correlation,
        List<AssetStatistics> assets
) {

    public static MetricsResponse from(AlignedPriceTable prices, MetricsResult metrics, List<AssetStatistics> assets) {
        List<List<Double>> correlation = new ArrayList<>();
        for (double[] row : metrics.correlation().values()) {
            correlation.add(Arrays.stream(row).boxed().toList());
        }
        return new MetricsResponse(
                prices.assetIds(),
                prices.firstTimestamp(),
                prices.lastTimestamp(),
                prices.size(),
                metrics.annualizedReturnPct(),
                metrics.annualizedVolatilityPct(),
                metrics.sharpeRatio(),
                metrics.maxDrawdown(),
                correlation,
                assets
        );
    }
}
