package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One future quarter produced by the forecast rollout. Lower and upper bounds
 * come from independent quantile models and are not guaranteed to be ordered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastPoint {

    private int year;

    private int quarter;

    @JsonProperty("predicted_value")
    private double predictedValue;

    @JsonProperty("confidence_lower")
    private double confidenceLower;

    @JsonProperty("confidence_upper")
    private double confidenceUpper;
}
