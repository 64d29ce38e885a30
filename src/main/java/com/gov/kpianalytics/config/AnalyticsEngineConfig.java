package com.gov.kpianalytics.config;

import com.gov.kpianalytics.model.ModelType;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "analytics")
public class AnalyticsEngineConfig {

    private Forecast forecast = new Forecast();

    private Anomaly anomaly = new Anomaly();

    private Kpi kpi = new Kpi();

    @PostConstruct
    public void validate() {
        if (forecast.confidenceLevel <= 0.0 || forecast.confidenceLevel >= 1.0) {
            throw new IllegalStateException("analytics.forecast.confidence-level must be in (0, 1), got "
                    + forecast.confidenceLevel);
        }
        if (forecast.numEstimators < 1) {
            throw new IllegalStateException("analytics.forecast.num-estimators must be >= 1");
        }
        if (forecast.defaultQuartersAhead < 1) {
            throw new IllegalStateException("analytics.forecast.default-quarters-ahead must be >= 1");
        }
        if (anomaly.criticalThreshold < anomaly.zscoreThreshold) {
            throw new IllegalStateException("analytics.anomaly.critical-threshold must be >= zscore-threshold");
        }
        if (anomaly.rollingWindow < 1) {
            throw new IllegalStateException("analytics.anomaly.rolling-window must be >= 1");
        }
        if (anomaly.contamination <= 0.0 || anomaly.contamination > 0.5) {
            throw new IllegalStateException("analytics.anomaly.contamination must be in (0, 0.5], got "
                    + anomaly.contamination);
        }
    }

    @Data
    public static class Forecast {
        private ModelType modelType = ModelType.GRADIENT_BOOSTING;
        private int numEstimators = 100;
        // Two-sided band; quantile models use alpha = (1 - level) / 2 and 1 - alpha
        private double confidenceLevel = 0.95;
        private int defaultQuartersAhead = 8;
        private long randomState = 42;
        private long cacheTtlMinutes = 60;
    }

    @Data
    public static class Anomaly {
        private double zscoreThreshold = 2.5;
        private double criticalThreshold = 3.5;
        private boolean useRollingStats = true;
        private int rollingWindow = 8;
        private long randomState = 42;
        // Expected share of outliers for the isolation forest
        private double contamination = 0.1;
        private int numEstimators = 200;
        private long cacheTtlMinutes = 30;
    }

    @Data
    public static class Kpi {
        // KPI ids for which a drop is good news; everything else is higher-is-better
        private List<String> lowerIsBetter = new ArrayList<>(List.of("unemployment_rate", "co2_index"));
    }
}
