package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A flagged observation. Numeric fields are rounded to 4 decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyResult {

    @JsonProperty("kpi_id")
    private String kpiId;

    @JsonProperty("region_id")
    private String regionId;

    private int year;

    private int quarter;

    @JsonProperty("actual_value")
    private double actualValue;

    // Baseline mean the observation was compared against
    @JsonProperty("expected_value")
    private double expectedValue;

    private double deviation;

    @JsonProperty("z_score")
    private double zScore;

    private AnomalySeverity severity;

    private AnomalyDirection direction;

    private String description;

    private DetectionMethod method;

    // Lombok would name these getZScore/setZScore, which Jackson reads as "zscore"
    @JsonProperty("z_score")
    public double getZScore() {
        return zScore;
    }

    @JsonProperty("z_score")
    public void setZScore(double zScore) {
        this.zScore = zScore;
    }
}
