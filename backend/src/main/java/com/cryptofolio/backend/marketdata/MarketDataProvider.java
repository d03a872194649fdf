package com.cryptofolio.backend.marketdata;

import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.PriceSeries;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Supplies cleaned price data to the portfolio engines. Repeated calls with the same arguments
 * within the configured time-to-live may be served from memory.
 */
public interface MarketDataProvider {

    /**
     * Display name to asset id of every asset clients may choose from.
     */
    Map<String, String> supportedAssets();

    PriceSeries fetchHistory(String assetId, int lookbackDays);

    AlignedPriceTable fetchAlignedSeries(List<String> assetIds, int lookbackDays);

    Optional<SpotQuote> fetchSpotQuote(String assetId);
}
