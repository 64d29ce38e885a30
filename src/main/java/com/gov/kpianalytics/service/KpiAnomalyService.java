package com.gov.kpianalytics.service;

import com.gov.kpianalytics.config.AnalyticsEngineConfig;
import com.gov.kpianalytics.config.EngineMetrics;
import com.gov.kpianalytics.engine.anomaly.IsolationForestAnomalyDetector;
import com.gov.kpianalytics.engine.anomaly.SeverityClassifier;
import com.gov.kpianalytics.engine.anomaly.ZScoreAnomalyDetector;
import com.gov.kpianalytics.model.AnomalyResult;
import com.gov.kpianalytics.model.DetectionMethod;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.repository.AnalyticsResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs the z-score and isolation-forest detectors with configured thresholds.
 * Detectors are built per call; degenerate series produce empty lists.
 */
@Service
public class KpiAnomalyService {

    private static final Logger log = LoggerFactory.getLogger(KpiAnomalyService.class);

    private final AnalyticsEngineConfig config;
    private final KpiPolarityResolver polarityResolver;
    private final EngineMetrics metrics;
    private final Optional<AnalyticsResultCache> resultCache;

    public KpiAnomalyService(AnalyticsEngineConfig config,
                             KpiPolarityResolver polarityResolver,
                             EngineMetrics metrics,
                             Optional<AnalyticsResultCache> resultCache) {
        this.config = config;
        this.polarityResolver = polarityResolver;
        this.metrics = metrics;
        this.resultCache = resultCache;
    }

    public List<AnomalyResult> detectZScore(String kpiId, String regionId, KpiSeries series) {
        return detectZScore(kpiId, regionId, series, polarityResolver.higherIsBetter(kpiId));
    }

    public List<AnomalyResult> detectZScore(String kpiId, String regionId, KpiSeries series,
                                            boolean higherIsBetter) {
        AnalyticsEngineConfig.Anomaly settings = config.getAnomaly();
        String fingerprint = SeriesFingerprint.of(DetectionMethod.ZSCORE.name(), kpiId, regionId, series,
                settings.getZscoreThreshold(), settings.getCriticalThreshold(),
                settings.isUseRollingStats(), settings.getRollingWindow(), higherIsBetter);

        return cachedOrCompute(DetectionMethod.ZSCORE, fingerprint, () -> {
            ZScoreAnomalyDetector detector = new ZScoreAnomalyDetector(classifier(),
                    settings.isUseRollingStats(), settings.getRollingWindow());
            return detector.detect(series, kpiId, regionId, higherIsBetter);
        }, kpiId, regionId);
    }

    public List<AnomalyResult> detectIsolationForest(String kpiId, String regionId, KpiSeries series) {
        return detectIsolationForest(kpiId, regionId, series, config.getAnomaly().getContamination());
    }

    public List<AnomalyResult> detectIsolationForest(String kpiId, String regionId, KpiSeries series,
                                                     double contamination) {
        AnalyticsEngineConfig.Anomaly settings = config.getAnomaly();
        String fingerprint = SeriesFingerprint.of(DetectionMethod.ISOLATION_FOREST.name(), kpiId, regionId, series,
                settings.getCriticalThreshold(), settings.getNumEstimators(),
                settings.getRandomState(), contamination);

        return cachedOrCompute(DetectionMethod.ISOLATION_FOREST, fingerprint, () -> {
            IsolationForestAnomalyDetector detector = new IsolationForestAnomalyDetector(classifier(),
                    settings.getNumEstimators(), settings.getRandomState());
            return detector.detect(series, kpiId, regionId, contamination);
        }, kpiId, regionId);
    }

    /** Z-score anomalies followed by isolation-forest anomalies. */
    public List<AnomalyResult> detectAll(String kpiId, String regionId, KpiSeries series) {
        List<AnomalyResult> all = new ArrayList<>(detectZScore(kpiId, regionId, series));
        all.addAll(detectIsolationForest(kpiId, regionId, series));
        return all;
    }

    private SeverityClassifier classifier() {
        AnalyticsEngineConfig.Anomaly settings = config.getAnomaly();
        return new SeverityClassifier(settings.getZscoreThreshold(), settings.getCriticalThreshold());
    }

    private List<AnomalyResult> cachedOrCompute(DetectionMethod method, String fingerprint,
                                                Supplier<List<AnomalyResult>> detection,
                                                String kpiId, String regionId) {
        Optional<AnomalyResult[]> cached = lookup(fingerprint);
        if (cached.isPresent()) {
            metrics.recordCacheHit(method.name());
            return List.of(cached.get());
        }

        List<AnomalyResult> anomalies = metrics.timeDetection(method.name(), detection);
        metrics.recordAnomalies(anomalies);

        resultCache.ifPresent(cache -> {
            try {
                cache.put(fingerprint, anomalies.toArray(new AnomalyResult[0]),
                        Duration.ofMinutes(config.getAnomaly().getCacheTtlMinutes()));
            } catch (Exception e) {
                log.warn("Failed to cache {} anomalies {}", method, fingerprint, e);
            }
        });

        log.info("{} detection for {}/{}: {} anomalies", method, kpiId, regionId, anomalies.size());
        return anomalies;
    }

    private Optional<AnomalyResult[]> lookup(String fingerprint) {
        if (resultCache.isEmpty()) return Optional.empty();
        try {
            return resultCache.get().get(fingerprint, AnomalyResult[].class);
        } catch (Exception e) {
            log.warn("Anomaly cache lookup failed for {}", fingerprint, e);
            return Optional.empty();
        }
    }
}
