package com.gov.kpianalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Forecast envelope for one (kpi, region) pair, predictions in chronological order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiForecast {

    @JsonProperty("kpi_id")
    private String kpiId;

    @JsonProperty("region_id")
    private String regionId;

    @JsonProperty("model_type")
    private ModelType modelType;

    private List<ForecastPoint> predictions;

    @JsonIgnore
    public List<ForecastResult> toResults() {
        return predictions.stream()
                .map(p -> ForecastResult.builder()
                        .kpiId(kpiId)
                        .regionId(regionId)
                        .year(p.getYear())
                        .quarter(p.getQuarter())
                        .predictedValue(p.getPredictedValue())
                        .confidenceLower(p.getConfidenceLower())
                        .confidenceUpper(p.getConfidenceUpper())
                        .modelType(modelType)
                        .build())
                .toList();
    }
}
