package com.cryptofolio.backend.marketdata;

import com.cryptofolio.backend.config.MarketDataProperties;
import com.cryptofolio.backend.exception.MarketDataException;
import com.cryptofolio.backend.exception.MarketDataRateLimitException;
import com.cryptofolio.backend.exception.MarketDataUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.function.Supplier;

/**
 * GET access to the CoinGecko REST API behind rate limiting, a circuit breaker and retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoinGeckoHttpClient {

    private final RestTemplate coinGeckoRestTemplate;
    private final CircuitBreaker coinGeckoCircuitBreaker;
    private final RateLimiter coinGeckoRateLimiter;
    private final Retry coinGeckoRetry;
    private final MarketDataProperties marketDataProperties;
    private final MeterRegistry meterRegistry;

    public String get(String url) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(url);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(coinGeckoRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(coinGeckoCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(coinGeckoRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            log.warn("CoinGecko circuit open url={}", url);
            throw new MarketDataUnavailableException("CoinGecko circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            log.warn("CoinGecko local rate limit exceeded url={}", url);
            throw new MarketDataRateLimitException("CoinGecko request rate exceeded", e);
        } catch (MarketDataException e) {
            log.warn("CoinGecko request failed url={} status={} message={}", url, e.getStatusCode(), e.getMessage());
            throw e;
        } catch (HttpServerErrorException e) {
            log.warn("CoinGecko server error url={} status={}", url, e.getStatusCode().value());
            throw new MarketDataException("CoinGecko server error (" + e.getStatusCode().value() + ")",
                    e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("CoinGecko unreachable url={} message={}", url, e.getMessage());
            throw new MarketDataException("CoinGecko unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("market_data_call_latency")
                    .tag("provider", "coingecko")
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            String userAgent = marketDataProperties.getUserAgent();
            if (userAgent != null && !userAgent.isBlank()) {
                headers.set(HttpHeaders.USER_AGENT, userAgent);
            }
            ResponseEntity<String> response = coinGeckoRestTemplate.exchange(url, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("CoinGecko rate limit 429 for {}", url);
            throw new MarketDataRateLimitException("CoinGecko rate limit", e);
        } catch (HttpClientErrorException e) {
            throw new MarketDataException("CoinGecko API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }
}
