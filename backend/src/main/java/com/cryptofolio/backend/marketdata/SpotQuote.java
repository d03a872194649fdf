package com.cryptofolio.backend.marketdata;

import java.time.Instant;

public record SpotQuote(
        String assetId,
        double price,
        double change24hPct,
        Instant fetchedAt
) {}
