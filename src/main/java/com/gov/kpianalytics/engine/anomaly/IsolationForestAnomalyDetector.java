package com.gov.kpianalytics.engine.anomaly;

import com.gov.kpianalytics.engine.SeriesStatistics;
import com.gov.kpianalytics.engine.StandardScaler;
import com.gov.kpianalytics.engine.isolationforest.IsolationForest;
import com.gov.kpianalytics.model.AnomalyDirection;
import com.gov.kpianalytics.model.AnomalyResult;
import com.gov.kpianalytics.model.DetectionMethod;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.Observation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Whole-series outlier detector over the joint (year, quarter, value) space.
 *
 * Unlike {@link ZScoreAnomalyDetector} this is not causal: the scaler, the
 * forest, and the reported z-scores all use the entire series at once, so
 * adding a new quarter can change verdicts for earlier ones. It is meant as a
 * batch re-audit of a complete history.
 *
 * Reported z-scores use the global value mean and sample std (std of 0 or
 * undefined is treated as 1). Rows with NaN or infinite values are dropped first.
 */
public class IsolationForestAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestAnomalyDetector.class);

    public static final int FEATURE_COUNT = 3;

    private final SeverityClassifier classifier;
    private final int numTrees;
    private final long randomState;

    public IsolationForestAnomalyDetector(SeverityClassifier classifier, int numTrees, long randomState) {
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        }
        this.classifier = classifier;
        this.numTrees = numTrees;
        this.randomState = randomState;
    }

    public List<AnomalyResult> detect(KpiSeries series, String kpiId, String regionId, double contamination) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        if (series == null || series.isEmpty()) {
            return Collections.emptyList();
        }

        List<Observation> rows = series.getObservations().stream()
                .filter(o -> Double.isFinite(o.value()))
                .toList();
        if (rows.isEmpty()) {
            return Collections.emptyList();
        }
        double[][] features = new double[rows.size()][FEATURE_COUNT];
        for (int i = 0; i < rows.size(); i++) {
            Observation o = rows.get(i);
            features[i][0] = o.year();
            features[i][1] = o.quarter();
            features[i][2] = o.value();
        }
        double[][] scaled = new StandardScaler().fitTransform(features);

        boolean[] outliers = new IsolationForest()
                .train(scaled, numTrees, IsolationForest.DEFAULT_MAX_SAMPLES, randomState)
                .outliers(scaled, contamination);

        double[] values = rows.stream().mapToDouble(Observation::value).toArray();
        double mean = SeriesStatistics.mean(values);
        double std = SeriesStatistics.sampleStd(values);
        if (std == 0.0 || Double.isNaN(std)) {
            std = 1.0;
        }

        List<AnomalyResult> anomalies = new ArrayList<>();
        for (int i = 0; i < outliers.length; i++) {
            if (!outliers[i]) continue;

            Observation o = rows.get(i);
            double actual = o.value();
            double zScore = (actual - mean) / std;
            AnomalyDirection direction = actual >= mean ? AnomalyDirection.HIGH : AnomalyDirection.LOW;

            anomalies.add(AnomalyResult.builder()
                    .kpiId(kpiId)
                    .regionId(regionId)
                    .year(o.year())
                    .quarter(o.quarter())
                    .actualValue(SeriesStatistics.round4(actual))
                    .expectedValue(SeriesStatistics.round4(mean))
                    .deviation(SeriesStatistics.round4(actual - mean))
                    .zScore(SeriesStatistics.round4(zScore))
                    .severity(classifier.classifyFlagged(zScore))
                    .direction(direction)
                    .description(SeverityClassifier.describeIsolation(direction, zScore))
                    .method(DetectionMethod.ISOLATION_FOREST)
                    .build());
        }

        log.debug("Isolation forest flagged {} of {} rows for {}/{}", anomalies.size(), rows.size(), kpiId, regionId);
        return anomalies;
    }

    public int getNumTrees() { return numTrees; }
    public long getRandomState() { return randomState; }
}
