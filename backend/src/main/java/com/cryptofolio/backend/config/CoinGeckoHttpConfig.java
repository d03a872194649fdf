package com.cryptofolio.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class CoinGeckoHttpConfig {

    @Bean
    public RestTemplate coinGeckoRestTemplate(MarketDataProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(properties.getHttp().getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
