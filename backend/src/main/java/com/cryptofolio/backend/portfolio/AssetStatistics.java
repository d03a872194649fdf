package com.cryptofolio.backend.portfolio;

public record AssetStatistics(
        String assetId,
        double annualizedReturnPct,
        double annualizedVolatilityPct
) {}
