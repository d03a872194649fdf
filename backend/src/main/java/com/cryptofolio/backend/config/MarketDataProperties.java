package com.cryptofolio.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "market-data")
@Data
@Validated
public class MarketDataProperties {

    @NotBlank
    private String baseUrl = "https://api.coingecko.com/api/v3";

    @NotBlank
    private String vsCurrency = "usd";

    private String userAgent = "cryptofolio/1.0";

    @NotNull
    private Duration historyTtl = Duration.ofMinutes(5);

    @NotNull
    private Duration quoteTtl = Duration.ofMinutes(1);

    @Min(1)
    private int dailyIntervalThresholdDays = 90;

    /**
     * Display name to upstream asset id, in the order offered to clients.
     */
    @NotEmpty
    private Map<String, String> supportedAssets = defaultAssets();

    private Http http = new Http();
    private Resilience resilience = new Resilience();

    private static Map<String, String> defaultAssets() {
        Map<String, String> assets = new LinkedHashMap<>();
        assets.put("Bitcoin", "bitcoin");
        assets.put("Ethereum", "ethereum");
        assets.put("Solana", "solana");
        assets.put("Cardano", "cardano");
        assets.put("XRP", "ripple");
        assets.put("Dogecoin", "dogecoin");
        return assets;
    }

    @Data
    public static class Http {
        @Min(1)
        private int connectTimeoutMs = 10000;

        @Min(1)
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Resilience {
        @Min(1)
        private int retryMaxAttempts = 3;

        @Min(1)
        private long retryBaseDelayMs = 500;

        private double retryJitterFactor = 0.2;

        private float circuitFailureRateThreshold = 50;

        @Min(1)
        private long circuitWaitOpenSeconds = 30;

        @Min(1)
        private int circuitSlidingWindowSize = 20;

        @Min(1)
        private int rateLimitPerSecond = 5;

        @Min(0)
        private long rateLimitTimeoutMs = 2000;
    }
}
