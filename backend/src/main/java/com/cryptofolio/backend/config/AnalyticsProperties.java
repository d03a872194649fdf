package com.cryptofolio.backend.config;

import com.cryptofolio.backend.portfolio.WeeklyBoundary;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
@Validated
public class AnalyticsProperties {

    @Min(1)
    private int annualizationFactor = 365;

    @DecimalMin("0.0")
    @DecimalMax("0.1")
    private double defaultRiskFreeRate = 0.02;

    @DecimalMin("0.0")
    @DecimalMax("0.01")
    private double weightTolerance = 0.0001;

    @NotBlank
    private String zone = "UTC";

    @NotNull
    private WeeklyBoundary weeklyBoundary = WeeklyBoundary.ISO_WEEK;

    @Min(2)
    private int defaultLookbackDays = 365;
}
