package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Regression ensemble used by the forecaster. Only gradient boosting carries
 * quantile models for the confidence band.
 */
public enum ModelType {
    GRADIENT_BOOSTING("gradient_boosting"),
    RANDOM_FOREST("random_forest");

    private final String code;

    ModelType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean hasQuantileModels() {
        return this == GRADIENT_BOOSTING;
    }

    public static ModelType fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Model type must not be null");
        }
        String normalized = code.trim().toLowerCase().replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.code.equals(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown model type: " + code
                        + ". Supported: gradient_boosting, random_forest"));
    }
}
