package com.gov.kpianalytics.config;

import com.gov.kpianalytics.model.AnomalyResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Supplier;

@Component
public class EngineMetrics {

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public <T> T timeForecast(String modelType, Supplier<T> work) {
        return Timer.builder("forecast.fit.duration")
                .tag("model_type", modelType)
                .register(registry)
                .record(work);
    }

    public <T> T timeDetection(String method, Supplier<T> work) {
        return Timer.builder("anomaly.detect.duration")
                .tag("method", method)
                .register(registry)
                .record(work);
    }

    public void recordForecast(String modelType, String outcome) {
        Counter.builder("forecast.count")
                .tag("model_type", modelType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAnomalies(List<AnomalyResult> anomalies) {
        for (AnomalyResult anomaly : anomalies) {
            Counter.builder("anomaly.detected.count")
                    .tag("method", anomaly.getMethod().name())
                    .tag("severity", anomaly.getSeverity().name())
                    .register(registry)
                    .increment();
        }
    }

    public void recordCacheHit(String kind) {
        Counter.builder("analytics.cache.hit.count")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
