package com.cryptofolio.backend.marketdata;

import com.cryptofolio.backend.config.AnalyticsProperties;
import com.cryptofolio.backend.config.MarketDataProperties;
import com.cryptofolio.backend.exception.MarketDataException;
import com.cryptofolio.backend.portfolio.PriceSeries;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Reads CoinGecko market charts and spot prices. Raw charts are collapsed to one price per
 * calendar day (the last observation of that day, stamped at the start of the day) so that
 * series of different coins share timestamps.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoinGeckoMarketDataClient {

    private final CoinGeckoHttpClient coinGeckoHttpClient;
    private final MarketDataProperties marketDataProperties;
    private final AnalyticsProperties analyticsProperties;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PriceSeries fetchDailyHistory(String assetId, int lookbackDays) {
        if (lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be positive: " + lookbackDays);
        }
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(marketDataProperties.getBaseUrl())
                .path("/coins/{id}/market_chart")
                .queryParam("vs_currency", marketDataProperties.getVsCurrency())
                .queryParam("days", lookbackDays);
        if (lookbackDays > marketDataProperties.getDailyIntervalThresholdDays()) {
            uri.queryParam("interval", "daily");
        }
        String url = uri.buildAndExpand(assetId).toUriString();
        JsonNode prices = read(coinGeckoHttpClient.get(url), assetId).path("prices");
        if (!prices.isArray()) {
            throw new MarketDataException("No prices returned for " + assetId);
        }

        ZoneId zone = ZoneId.of(analyticsProperties.getZone());
        TreeMap<Instant, Double> daily = new TreeMap<>();
        for (JsonNode point : prices) {
            if (!point.isArray() || point.size() < 2 || point.get(1).isNull()) {
                continue;
            }
            Instant observed = Instant.ofEpochMilli(point.get(0).asLong());
            LocalDate day = observed.atZone(zone).toLocalDate();
            // points arrive in time order, so the last write per day is its closing price
            daily.put(day.atStartOfDay(zone).toInstant(), point.get(1).asDouble());
        }
        log.debug("Fetched history asset={} days={} rawPoints={} dailyPoints={}",
                assetId, lookbackDays, prices.size(), daily.size());
        return new PriceSeries(assetId, daily);
    }

    public Optional<SpotQuote> fetchSpotQuote(String assetId) {
        String url = UriComponentsBuilder.fromHttpUrl(marketDataProperties.getBaseUrl())
                .path("/simple/price")
                .queryParam("ids", assetId)
                .queryParam("vs_currencies", marketDataProperties.getVsCurrency())
                .queryParam("include_24hr_change", true)
                .toUriString();
        JsonNode coin = read(coinGeckoHttpClient.get(url), assetId).path(assetId);
        String currency = marketDataProperties.getVsCurrency();
        JsonNode price = coin.path(currency);
        if (!price.isNumber() || price.asDouble() <= 0) {
            return Optional.empty();
        }
        double change = coin.path(currency + "_24h_change").asDouble(0.0);
        return Optional.of(new SpotQuote(assetId, price.asDouble(), change, clock.instant()));
    }

    private JsonNode read(String body, String assetId) {
        if (body == null || body.isBlank()) {
            throw new MarketDataException("Empty response for " + assetId);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Malformed response for " + assetId + ": " + e.getOriginalMessage(), e);
        }
    }
}
