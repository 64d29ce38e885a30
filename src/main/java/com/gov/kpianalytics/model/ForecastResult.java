package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResult {

    @JsonProperty("kpi_id")
    private String kpiId;

    @JsonProperty("region_id")
    private String regionId;

    private int year;

    private int quarter;

    @JsonProperty("predicted_value")
    private double predictedValue;

    @JsonProperty("confidence_lower")
    private double confidenceLower;

    @JsonProperty("confidence_upper")
    private double confidenceUpper;

    @JsonProperty("model_type")
    private ModelType modelType;
}
