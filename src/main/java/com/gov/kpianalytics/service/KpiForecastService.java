package com.gov.kpianalytics.service;

import com.gov.kpianalytics.config.AnalyticsEngineConfig;
import com.gov.kpianalytics.config.EngineMetrics;
import com.gov.kpianalytics.engine.forecast.KpiForecaster;
import com.gov.kpianalytics.exception.AnalyticsEngineException;
import com.gov.kpianalytics.model.ForecastPoint;
import com.gov.kpianalytics.model.KpiForecast;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.ModelType;
import com.gov.kpianalytics.repository.AnalyticsResultCache;
import com.gov.kpianalytics.repository.ForecastModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for KPI forecasts.
 *
 * Flow:
 * 1. Fingerprint the request and return a cached forecast if one exists
 * 2. Build a fresh forecaster from configuration (one per call)
 * 3. Fit on the series and roll forward the requested number of quarters
 * 4. Hand the fitted model to the model store, if configured
 * 5. Cache and return the forecast
 */
@Service
public class KpiForecastService {

    private static final Logger log = LoggerFactory.getLogger(KpiForecastService.class);

    private final AnalyticsEngineConfig config;
    private final EngineMetrics metrics;
    private final Optional<ForecastModelStore> modelStore;
    private final Optional<AnalyticsResultCache> resultCache;

    public KpiForecastService(AnalyticsEngineConfig config,
                              EngineMetrics metrics,
                              Optional<ForecastModelStore> modelStore,
                              Optional<AnalyticsResultCache> resultCache) {
        this.config = config;
        this.metrics = metrics;
        this.modelStore = modelStore;
        this.resultCache = resultCache;
    }

    public KpiForecast forecast(String kpiId, String regionId, KpiSeries series) {
        return forecast(kpiId, regionId, series, config.getForecast().getDefaultQuartersAhead());
    }

    public KpiForecast forecast(String kpiId, String regionId, KpiSeries series, int quartersAhead) {
        return forecast(kpiId, regionId, series, quartersAhead, config.getForecast().getModelType());
    }

    /**
     * @throws AnalyticsEngineException when the series cannot be fitted
     *         (too short, constant, or containing NaN/infinite values)
     */
    public KpiForecast forecast(String kpiId, String regionId, KpiSeries series,
                                int quartersAhead, ModelType modelType) {
        AnalyticsEngineConfig.Forecast settings = config.getForecast();
        String fingerprint = SeriesFingerprint.of("forecast", kpiId, regionId, series,
                modelType.getCode(), settings.getNumEstimators(), settings.getConfidenceLevel(),
                settings.getRandomState(), quartersAhead);

        Optional<KpiForecast> cached = lookup(fingerprint);
        if (cached.isPresent()) {
            metrics.recordCacheHit("forecast");
            log.debug("Forecast cache hit for {}/{}", kpiId, regionId);
            return cached.get();
        }

        KpiForecaster forecaster = new KpiForecaster(modelType, settings.getNumEstimators(),
                settings.getConfidenceLevel(), settings.getRandomState());

        List<ForecastPoint> predictions;
        try {
            predictions = metrics.timeForecast(modelType.getCode(),
                    () -> forecaster.fit(series).predict(quartersAhead));
        } catch (AnalyticsEngineException e) {
            metrics.recordForecast(modelType.getCode(), e.getCode());
            log.warn("Forecast rejected for {}/{}: {} ({})", kpiId, regionId, e.getMessage(), e.getCode());
            throw e;
        }
        metrics.recordForecast(modelType.getCode(), "success");

        modelStore.ifPresent(store -> saveModel(store, kpiId, regionId, modelType, fingerprint, forecaster));

        KpiForecast forecast = KpiForecast.builder()
                .kpiId(kpiId)
                .regionId(regionId)
                .modelType(modelType)
                .predictions(predictions)
                .build();

        resultCache.ifPresent(cache -> store(cache, fingerprint, forecast,
                Duration.ofMinutes(settings.getCacheTtlMinutes())));

        log.info("Forecast {}/{}: {} points -> {} quarters ({})",
                kpiId, regionId, series.size(), predictions.size(), modelType.getCode());
        return forecast;
    }

    static String modelId(String kpiId, String regionId, ModelType modelType, String fingerprint) {
        return String.join(":", kpiId, regionId, modelType.getCode(), fingerprint.substring(0, 12));
    }

    private void saveModel(ForecastModelStore store, String kpiId, String regionId,
                           ModelType modelType, String fingerprint, KpiForecaster forecaster) {
        String modelId = modelId(kpiId, regionId, modelType, fingerprint);
        try {
            store.save(modelId, forecaster.getFittedModel());
        } catch (Exception e) {
            log.error("Failed to save fitted model {}", modelId, e);
        }
    }

    private Optional<KpiForecast> lookup(String fingerprint) {
        if (resultCache.isEmpty()) return Optional.empty();
        try {
            return resultCache.get().get(fingerprint, KpiForecast.class);
        } catch (Exception e) {
            log.warn("Forecast cache lookup failed for {}", fingerprint, e);
            return Optional.empty();
        }
    }

    private void store(AnalyticsResultCache cache, String fingerprint, Object value, Duration ttl) {
        try {
            cache.put(fingerprint, value, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache forecast {}", fingerprint, e);
        }
    }
}
