package com.gov.kpianalytics.engine.anomaly;

import com.gov.kpianalytics.engine.SeriesStatistics;
import com.gov.kpianalytics.model.AnomalyDirection;
import com.gov.kpianalytics.model.AnomalyResult;
import com.gov.kpianalytics.model.AnomalySeverity;
import com.gov.kpianalytics.model.DetectionMethod;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Causal z-score outlier detector for a single quarterly series.
 *
 * Each observation is compared only against observations strictly before it:
 *   - with rolling stats enabled and at least {@code rollingWindow} predecessors,
 *     the baseline is the preceding {@code rollingWindow} points;
 *   - otherwise the baseline is every predecessor (expanding window),
 *     provided there are at least two of them.
 * Points whose baseline has zero or undefined spread are skipped.
 *
 * Degenerate input (empty, fewer than 4 points, constant, or fewer than 4
 * finite points) yields no anomalies rather than an error.
 */
public class ZScoreAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreAnomalyDetector.class);

    public static final int MIN_ANOMALY_POINTS = 4;
    private static final int MIN_EXPANDING_BASELINE = 2;

    private final SeverityClassifier classifier;
    private final boolean useRollingStats;
    private final int rollingWindow;

    public ZScoreAnomalyDetector(SeverityClassifier classifier, boolean useRollingStats, int rollingWindow) {
        if (rollingWindow < 1) {
            throw new IllegalArgumentException("rollingWindow must be >= 1, got " + rollingWindow);
        }
        this.classifier = classifier;
        this.useRollingStats = useRollingStats;
        this.rollingWindow = rollingWindow;
    }

    public List<AnomalyResult> detect(KpiSeries series, String kpiId, String regionId, boolean higherIsBetter) {
        if (series == null || series.size() < MIN_ANOMALY_POINTS) {
            return Collections.emptyList();
        }

        double overallStd = SeriesStatistics.sampleStd(finiteValues(series));
        if (overallStd == 0.0) {
            log.debug("Constant series for {}/{}; no anomalies to detect", kpiId, regionId);
            return Collections.emptyList();
        }

        List<Observation> clean = new ArrayList<>();
        for (Observation o : series.getObservations()) {
            if (Double.isFinite(o.value())) clean.add(o);
        }
        if (clean.size() < MIN_ANOMALY_POINTS) {
            return Collections.emptyList();
        }

        KpiSeries ordered = KpiSeries.of(clean).sorted();
        double[] values = ordered.values();
        List<AnomalyResult> anomalies = new ArrayList<>();

        for (int i = 0; i < values.length; i++) {
            int from;
            if (useRollingStats && i >= rollingWindow) {
                from = i - rollingWindow;
            } else if (i >= MIN_EXPANDING_BASELINE) {
                from = 0;
            } else {
                continue;
            }

            double mean = SeriesStatistics.mean(values, from, i);
            double std = SeriesStatistics.sampleStd(values, from, i);
            if (std == 0.0 || Double.isNaN(std)) {
                continue;
            }

            double value = values[i];
            double zScore = (value - mean) / std;
            if (!classifier.exceedsWarning(zScore)) {
                continue;
            }

            AnomalyDirection direction = SeverityClassifier.direction(zScore);
            AnomalySeverity severity = classifier.classifyFlagged(zScore);
            double deviationPct = mean != 0.0 ? (value - mean) / mean * 100.0 : 0.0;

            Observation obs = ordered.get(i);
            anomalies.add(AnomalyResult.builder()
                    .kpiId(kpiId)
                    .regionId(regionId)
                    .year(obs.year())
                    .quarter(obs.quarter())
                    .actualValue(SeriesStatistics.round4(value))
                    .expectedValue(SeriesStatistics.round4(mean))
                    .deviation(SeriesStatistics.round4(value - mean))
                    .zScore(SeriesStatistics.round4(zScore))
                    .severity(severity)
                    .direction(direction)
                    .description(SeverityClassifier.describeZScore(direction, higherIsBetter, deviationPct, zScore))
                    .method(DetectionMethod.ZSCORE)
                    .build());
        }

        return anomalies;
    }

    /** NaN and infinite values are left out of the constant-series check. */
    private static double[] finiteValues(KpiSeries series) {
        return series.getObservations().stream()
                .mapToDouble(Observation::value)
                .filter(Double::isFinite)
                .toArray();
    }

    public boolean isUseRollingStats() { return useRollingStats; }
    public int getRollingWindow() { return rollingWindow; }
    public SeverityClassifier getClassifier() { return classifier; }
}
