package com.cryptofolio.backend.marketdata;

import com.cryptofolio.backend.config.MarketDataProperties;
import com.cryptofolio.backend.exception.InsufficientDataException;
import com.cryptofolio.backend.portfolio.AlignedPriceTable;
import com.cryptofolio.backend.portfolio.PriceAligner;
import com.cryptofolio.backend.portfolio.PriceSeries;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CoinGecko-backed provider with a courtesy cache: histories live for
 * {@code market-data.history-ttl}, spot quotes for {@code market-data.quote-ttl}.
 */
@Slf4j
@Service
public class DefaultMarketDataProvider implements MarketDataProvider {

    private final CoinGeckoMarketDataClient client;
    private final PriceAligner priceAligner;
    private final MarketDataProperties properties;
    private final TtlCache<HistoryKey, PriceSeries> historyCache;
    private final TtlCache<String, SpotQuote> quoteCache;
    private final Counter cacheHits;

    public DefaultMarketDataProvider(CoinGeckoMarketDataClient client,
                                     PriceAligner priceAligner,
                                     MarketDataProperties properties,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        this.client = client;
        this.priceAligner = priceAligner;
        this.properties = properties;
        this.historyCache = new TtlCache<>(properties.getHistoryTtl(), clock);
        this.quoteCache = new TtlCache<>(properties.getQuoteTtl(), clock);
        this.cacheHits = Counter.builder("market_data_cache_hits_total").register(meterRegistry);
    }

    @Override
    public Map<String, String> supportedAssets() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties.getSupportedAssets()));
    }

    @Override
    public PriceSeries fetchHistory(String assetId, int lookbackDays) {
        if (assetId == null || assetId.isBlank()) {
            throw new InsufficientDataException("Missing asset id");
        }
        HistoryKey key = new HistoryKey(assetId, lookbackDays);
        Optional<PriceSeries> cached = historyCache.get(key);
        if (cached.isPresent()) {
            cacheHits.increment();
            return cached.get();
        }
        PriceSeries series = client.fetchDailyHistory(assetId, lookbackDays);
        historyCache.put(key, series);
        return series;
    }

    @Override
    public AlignedPriceTable fetchAlignedSeries(List<String> assetIds, int lookbackDays) {
        if (assetIds == null || assetIds.isEmpty()) {
            throw new InsufficientDataException("No assets requested");
        }
        List<PriceSeries> series = new ArrayList<>(assetIds.size());
        for (String assetId : assetIds) {
            series.add(fetchHistory(assetId, lookbackDays));
        }
        AlignedPriceTable table = priceAligner.align(series);
        log.info("Aligned series assets={} lookbackDays={} rows={}", assetIds, lookbackDays, table.size());
        return table;
    }

    @Override
    public Optional<SpotQuote> fetchSpotQuote(String assetId) {
        Optional<SpotQuote> cached = quoteCache.get(assetId);
        if (cached.isPresent()) {
            cacheHits.increment();
            return cached;
        }
        Optional<SpotQuote> quote = client.fetchSpotQuote(assetId);
        quote.ifPresent(value -> quoteCache.put(assetId, value));
        return quote;
    }

    private record HistoryKey(String assetId, int lookbackDays) {}
}
