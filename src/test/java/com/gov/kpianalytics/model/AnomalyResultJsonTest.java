package com.gov.kpianalytics.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyResultJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void anomalyResult_serializesWithSnakeCaseNamesAndLowerCaseEnums() throws Exception {
        AnomalyResult result = AnomalyResult.builder()
                .kpiId("gdp_growth")
                .regionId("r1")
                .year(2024)
                .quarter(1)
                .actualValue(150.0)
                .expectedValue(77.0)
                .deviation(73.0)
                .zScore(14.9011)
                .severity(AnomalySeverity.CRITICAL)
                .direction(AnomalyDirection.HIGH)
                .description("Positive anomaly")
                .method(DetectionMethod.ZSCORE)
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("kpi_id").asText()).isEqualTo("gdp_growth");
        assertThat(json.get("z_score").asDouble()).isEqualTo(14.9011);
        assertThat(json.has("zscore")).isFalse();
        assertThat(json.get("expected_value").asDouble()).isEqualTo(77.0);
        assertThat(json.get("severity").asText()).isEqualTo("critical");
        assertThat(json.get("direction").asText()).isEqualTo("high");
    }

    @Test
    void kpiForecast_serializesModelTypeCodeAndPredictions() throws Exception {
        KpiForecast forecast = KpiForecast.builder()
                .kpiId("gdp_growth")
                .regionId("r1")
                .modelType(ModelType.RANDOM_FOREST)
                .predictions(List.of(ForecastPoint.builder()
                        .year(2025).quarter(1).predictedValue(1.5).confidenceLower(1.0).confidenceUpper(2.0)
                        .build()))
                .build();

        JsonNode json = mapper.readTree(mapper.writeValueAsString(forecast));

        assertThat(json.get("model_type").asText()).isEqualTo("random_forest");
        assertThat(json.get("predictions").get(0).get("predicted_value").asDouble()).isEqualTo(1.5);
        assertThat(json.has("results")).isFalse();
    }

    @Test
    void modelType_fromCodeAcceptsCodesAndNames() {
        assertThat(ModelType.fromCode("gradient_boosting")).isEqualTo(ModelType.GRADIENT_BOOSTING);
        assertThat(ModelType.fromCode("RANDOM-FOREST")).isEqualTo(ModelType.RANDOM_FOREST);
    }
}
