package com.cryptofolio.backend.dto;

import com.cryptofolio.backend.portfolio.RebalancingFrequency;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Portfolio to analyse. {@code frequency}, {@code lookbackDays} and {@code riskFreeRate} fall
 * back to buy-and-hold and the configured defaults when omitted.
 */
public record PortfolioRequest(
        @NotEmpty List<@NotBlank String> assetIds,
        @NotEmpty List<@NotNull Double> weights,
        RebalancingFrequency frequency,
        @Min(2) @Max(3650) Integer lookbackDays,
        @DecimalMin("0.0") @DecimalMax("0.1") Double riskFreeRate
) {}
