package com.cryptofolio.backend.portfolio;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum RebalancingFrequency {
    NONE("None"),
    DAILY("D"),
    WEEKLY("W"),
    MONTHLY("M");

    private final String code;

    RebalancingFrequency(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Accepts either the enum name ({@code WEEKLY}) or its short code ({@code W}).
     */
    @JsonCreator
    public static RebalancingFrequency fromCode(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        String normalized = value.trim();
        for (RebalancingFrequency frequency : values()) {
            if (frequency.name().equalsIgnoreCase(normalized) || frequency.code.equalsIgnoreCase(normalized)) {
                return frequency;
            }
        }
        throw new IllegalArgumentException("Unknown rebalancing frequency: " + value.toUpperCase(Locale.ROOT));
    }
}
