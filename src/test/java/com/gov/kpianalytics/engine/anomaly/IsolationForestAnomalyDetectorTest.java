package com.gov.kpianalytics.engine.anomaly;

import com.gov.kpianalytics.model.AnomalyDirection;
import com.gov.kpianalytics.model.AnomalyResult;
import com.gov.kpianalytics.model.AnomalySeverity;
import com.gov.kpianalytics.model.DetectionMethod;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.Observation;
import com.gov.kpianalytics.testutil.TestSeriesFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsolationForestAnomalyDetectorTest {

    private final SeverityClassifier classifier = new SeverityClassifier(2.5, 3.5);
    private final IsolationForestAnomalyDetector detector = new IsolationForestAnomalyDetector(classifier, 200, 42);

    @Test
    void detect_obviousOutlier_isFlaggedAsCriticalHigh() {
        List<AnomalyResult> anomalies = detector.detect(TestSeriesFactory.noisyWithOutlier(), "k", "r", 0.1);

        assertThat(anomalies).isNotEmpty();
        assertThat(anomalies).anySatisfy(a -> {
            assertThat(a.getYear()).isEqualTo(2022);
            assertThat(a.getQuarter()).isEqualTo(3);
            assertThat(a.getActualValue()).isEqualTo(15.0);
            assertThat(a.getDirection()).isEqualTo(AnomalyDirection.HIGH);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.CRITICAL);
            assertThat(a.getMethod()).isEqualTo(DetectionMethod.ISOLATION_FOREST);
            assertThat(a.getDescription()).startsWith("IsolationForest anomaly: high deviation (z=");
        });
    }

    @Test
    void detect_flagsRoughlyTheContaminationShare() {
        List<AnomalyResult> anomalies = detector.detect(TestSeriesFactory.noisyWithOutlier(), "k", "r", 0.1);

        assertThat(anomalies).hasSizeLessThanOrEqualTo(5);
    }

    @Test
    void detect_sameSeed_isDeterministic() {
        KpiSeries series = TestSeriesFactory.noisyWithOutlier();

        List<AnomalyResult> first = new IsolationForestAnomalyDetector(classifier, 100, 7).detect(series, "k", "r", 0.1);
        List<AnomalyResult> second = new IsolationForestAnomalyDetector(classifier, 100, 7).detect(series, "k", "r", 0.1);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void detect_identicalRows_completesWithoutAnomalies() {
        KpiSeries series = KpiSeries.of(List.of(
                Observation.of(2024, 1, 5.0),
                Observation.of(2024, 1, 5.0),
                Observation.of(2024, 1, 5.0),
                Observation.of(2024, 1, 5.0),
                Observation.of(2024, 1, 5.0)));

        assertThat(detector.detect(series, "k", "r", 0.1)).isEmpty();
    }

    @Test
    void detect_constantValues_reportsZScoreAgainstUnitStd() {
        // value column is constant, so any flagged row has z = 0
        List<AnomalyResult> anomalies = detector.detect(TestSeriesFactory.constant(20, 5.0), "k", "r", 0.1);

        assertThat(anomalies).allSatisfy(a -> {
            assertThat(a.getZScore()).isEqualTo(0.0);
            assertThat(a.getDirection()).isEqualTo(AnomalyDirection.HIGH);
            assertThat(a.getSeverity()).isEqualTo(AnomalySeverity.WARNING);
        });
    }

    @Test
    void detect_emptyOrAllNaN_returnsEmpty() {
        assertThat(detector.detect(KpiSeries.empty(), "k", "r", 0.1)).isEmpty();
        assertThat(detector.detect(null, "k", "r", 0.1)).isEmpty();
        assertThat(detector.detect(KpiSeries.quarterly(2024, 1, Double.NaN, Double.NaN), "k", "r", 0.1)).isEmpty();
    }

    @Test
    void detect_invalidContamination_throws() {
        KpiSeries series = TestSeriesFactory.noisyWithOutlier();

        assertThatThrownBy(() -> detector.detect(series, "k", "r", 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.detect(series, "k", "r", 0.6)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_zeroTrees_throws() {
        assertThatThrownBy(() -> new IsolationForestAnomalyDetector(classifier, 0, 42))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
