package com.cryptofolio.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI cryptofolioOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cryptofolio Portfolio Analytics API")
                        .description("Risk/return metrics and rebalancing simulation for multi-asset crypto portfolios")
                        .version("1.0"));
    }
}
