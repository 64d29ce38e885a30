package com.gov.kpianalytics;

import com.gov.kpianalytics.config.AnalyticsEngineConfig;
import com.gov.kpianalytics.model.KpiForecast;
import com.gov.kpianalytics.model.ModelType;
import com.gov.kpianalytics.service.KpiAnomalyService;
import com.gov.kpianalytics.service.KpiForecastService;
import com.gov.kpianalytics.testutil.TestSeriesFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "analytics.forecast.model-type=random_forest",
        "analytics.forecast.num-estimators=20",
        "analytics.kpi.lower-is-better=unemployment_rate,crime_rate"
})
class KpiAnalyticsApplicationTest {

    @Autowired
    private AnalyticsEngineConfig config;

    @Autowired
    private KpiForecastService forecastService;

    @Autowired
    private KpiAnomalyService anomalyService;

    @Test
    void contextLoads_bindsAnalyticsProperties() {
        assertThat(config.getForecast().getModelType()).isEqualTo(ModelType.RANDOM_FOREST);
        assertThat(config.getForecast().getNumEstimators()).isEqualTo(20);
        assertThat(config.getAnomaly().getRollingWindow()).isEqualTo(8);
        assertThat(config.getKpi().getLowerIsBetter()).containsExactly("unemployment_rate", "crime_rate");
    }

    @Test
    void servicesWork_withoutStoreOrCacheBeans() {
        KpiForecast forecast = forecastService.forecast("gdp_growth", "r1", TestSeriesFactory.linearGrowth(), 2);

        assertThat(forecast.getModelType()).isEqualTo(ModelType.RANDOM_FOREST);
        assertThat(forecast.getPredictions()).hasSize(2);
        assertThat(anomalyService.detectZScore("crime_rate", "r1", TestSeriesFactory.spikeAtEnd()))
                .singleElement()
                .satisfies(a -> assertThat(a.getDescription()).startsWith("Concerning anomaly"));
    }
}
