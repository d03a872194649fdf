package com.cryptofolio.backend.config;

import com.cryptofolio.backend.portfolio.RebalancingFrequency;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "report")
@Data
@Validated
public class ReportProperties {

    private boolean enabled = false;

    @NotBlank
    private String cron = "0 0 20 * * *";

    @NotBlank
    private String directory = "reports";

    @NotEmpty
    private List<String> assets = new ArrayList<>(List.of("bitcoin", "ethereum", "solana"));

    @NotEmpty
    private List<Double> weights = new ArrayList<>(List.of(0.4, 0.3, 0.3));

    @NotNull
    private RebalancingFrequency frequency = RebalancingFrequency.WEEKLY;

    @Min(2)
    private int lookbackDays = 365;
}
