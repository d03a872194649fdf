package com.cryptofolio.backend.portfolio;

import com.cryptofolio.backend.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Intersects per-asset price histories onto the timestamps every asset has in common.
 * Gaps are never forward-filled: a timestamp missing from any one series is dropped from all.
 */
@Slf4j
public class PriceAligner {

    public AlignedPriceTable align(List<PriceSeries> series) {
        if (series == null || series.isEmpty()) {
            throw new InsufficientDataException("No price series supplied");
        }
        List<String> assetIds = new ArrayList<>(series.size());
        NavigableSet<Instant> common = null;
        for (PriceSeries priceSeries : series) {
            if (priceSeries == null) {
                throw new InsufficientDataException("Missing price series");
            }
            if (assetIds.contains(priceSeries.assetId())) {
                throw new IllegalArgumentException("Duplicate asset " + priceSeries.assetId());
            }
            if (priceSeries.isEmpty()) {
                throw new InsufficientDataException("Empty price series for " + priceSeries.assetId());
            }
            assetIds.add(priceSeries.assetId());
            if (common == null) {
                common = new TreeSet<>(priceSeries.prices().keySet());
            } else {
                common.retainAll(priceSeries.prices().keySet());
            }
        }
        if (common.isEmpty()) {
            throw new InsufficientDataException("Price series for " + assetIds + " share no timestamps");
        }

        List<Instant> timestamps = new ArrayList<>(common);
        double[][] prices = new double[timestamps.size()][assetIds.size()];
        for (int row = 0; row < timestamps.size(); row++) {
            Instant timestamp = timestamps.get(row);
            for (int asset = 0; asset < series.size(); asset++) {
                prices[row][asset] = series.get(asset).prices().get(timestamp);
            }
        }
        log.debug("Aligned assets={} rows={} dropped={}", assetIds, timestamps.size(),
                series.stream().mapToInt(PriceSeries::size).max().orElse(0) - timestamps.size());
        return new AlignedPriceTable(assetIds, timestamps, prices);
    }

    /**
     * Aligns the series of a map in its iteration order; pass a {@link java.util.LinkedHashMap}
     * to control the column order.
     */
    public AlignedPriceTable align(Map<String, PriceSeries> seriesByAsset) {
        if (seriesByAsset == null || seriesByAsset.isEmpty()) {
            throw new InsufficientDataException("No price series supplied");
        }
        List<PriceSeries> ordered = new ArrayList<>(seriesByAsset.size());
        for (Map.Entry<String, PriceSeries> entry : seriesByAsset.entrySet()) {
            if (entry.getValue() == null) {
                throw new InsufficientDataException("Missing price series for " + entry.getKey());
            }
            ordered.add(entry.getValue());
        }
        return align(ordered);
    }
}
