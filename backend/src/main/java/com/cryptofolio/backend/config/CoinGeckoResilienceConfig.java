package com.cryptofolio.backend.config;

import com.cryptofolio.backend.exception.MarketDataRateLimitException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class CoinGeckoResilienceConfig {

    @Bean
    public CircuitBreaker coinGeckoCircuitBreaker(MarketDataProperties properties) {
        MarketDataProperties.Resilience resilience = properties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(resilience.getCircuitFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(resilience.getCircuitWaitOpenSeconds()))
                .slidingWindowSize(resilience.getCircuitSlidingWindowSize())
                .build();
        return CircuitBreaker.of("coingecko", config);
    }

    @Bean
    public RateLimiter coinGeckoRateLimiter(MarketDataProperties properties) {
        MarketDataProperties.Resilience resilience = properties.getResilience();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(resilience.getRateLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(resilience.getRateLimitTimeoutMs()))
                .build();
        return RateLimiter.of("coingecko", config);
    }

    @Bean
    public Retry coinGeckoRetry(MarketDataProperties properties) {
        MarketDataProperties.Resilience resilience = properties.getResilience();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(resilience.getRetryBaseDelayMs()),
                2.0,
                resilience.getRetryJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(resilience.getRetryMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(MarketDataRateLimitException.class, ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("coingecko", config);
    }
}
