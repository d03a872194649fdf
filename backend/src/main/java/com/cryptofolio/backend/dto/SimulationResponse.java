package com.cryptofolio.backend.dto;

import com.cryptofolio.backend.portfolio.RebalancingFrequency;
import com.cryptofolio.backend.portfolio.SimulationResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record SimulationResponse(
        List<String> assetIds,
        RebalancingFrequency frequency,
        int rebalanceCount,
        double finalValue,
        double totalReturnPct,
        double maxDrawdown,
        List<Double> finalAllocation,
        List<Double> quantityDriftPct,
        List<Point> points
) {

    public record Point(
            Instant timestamp,
            double value,
            List<Double> quantities,
            boolean rebalanced
    ) {}

    public static SimulationResponse from(SimulationResult result) {
        Set<Instant> rebalances = new HashSet<>(result.rebalanceTimestamps());
        List<Point> points = new ArrayList<>(result.size());
        for (int row = 0; row < result.size(); row++) {
            Instant timestamp = result.timestamp(row);
            points.add(new Point(
                    timestamp,
                    result.value(row),
                    Arrays.stream(result.quantitiesAt(row)).boxed().toList(),
                    rebalances.contains(timestamp)
            ));
        }
        List<Double> drift = new ArrayList<>(result.assetIds().size());
        for (int asset = 0; asset < result.assetIds().size(); asset++) {
            drift.add(result.quantityDriftPct(asset));
        }
        return new SimulationResponse(
                result.assetIds(),
                result.frequency(),
                result.rebalanceTimestamps().size(),
                result.finalValue(),
                result.totalReturnPct(),
                result.maxDrawdown(),
                Arrays.stream(result.finalAllocation()).boxed().toList(),
                drift,
                points
        );
    }
}
