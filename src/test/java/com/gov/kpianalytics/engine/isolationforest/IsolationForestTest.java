package com.gov.kpianalytics.engine.isolationforest;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationForestTest {

    private static double[][] clusterWithOutlier() {
        double[][] data = new double[11][1];
        for (int i = 0; i < 10; i++) {
            data[i][0] = i * 0.1;
        }
        data[10][0] = 10.0;
        return data;
    }

    @Test
    void anomalyScore_outlierScoresHigherThanClusterPoints() {
        double[][] data = clusterWithOutlier();
        IsolationForest forest = new IsolationForest().train(data, 200, IsolationForest.DEFAULT_MAX_SAMPLES, 42);

        double outlierScore = forest.anomalyScore(data[10]);
        for (int i = 0; i < 10; i++) {
            assertThat(outlierScore).isGreaterThan(forest.anomalyScore(data[i]));
        }
        assertThat(outlierScore).isBetween(0.0, 1.0);
    }

    @Test
    void outliers_flagsOnlyRowsAboveContaminationPercentile() {
        double[][] data = clusterWithOutlier();
        IsolationForest forest = new IsolationForest().train(data, 200, IsolationForest.DEFAULT_MAX_SAMPLES, 42);

        boolean[] labels = forest.outliers(data, 0.1);

        assertThat(labels[10]).isTrue();
        int flagged = 0;
        for (boolean label : labels) {
            if (label) flagged++;
        }
        assertThat(flagged).isEqualTo(1);
    }

    @Test
    void outliers_identicalRows_noneFlagged() {
        double[][] data = {{1, 1}, {1, 1}, {1, 1}, {1, 1}};
        IsolationForest forest = new IsolationForest().train(data, 50, IsolationForest.DEFAULT_MAX_SAMPLES, 1);

        assertThat(forest.outliers(data, 0.25)).containsOnly(false);
    }

    @Test
    void train_capsSampleSizeAtRowCount() {
        IsolationForest forest = new IsolationForest().train(clusterWithOutlier(), 10, 256, 42);

        assertThat(forest.getSampleSize()).isEqualTo(11);
        assertThat(forest.getTrees()).hasSize(10);
    }

    @Test
    void train_subsamplesLargeInputs() {
        double[][] data = new double[50][1];
        for (int i = 0; i < data.length; i++) data[i][0] = i;

        IsolationForest forest = new IsolationForest().train(data, 5, 16, 42);

        assertThat(forest.getSampleSize()).isEqualTo(16);
    }

    @Test
    void anomalyScores_sameSeed_isDeterministic() {
        double[][] data = clusterWithOutlier();

        double[] a = new IsolationForest().train(data, 50, 256, 3).anomalyScores(data);
        double[] b = new IsolationForest().train(data, 50, 256, 3).anomalyScores(data);

        assertThat(a).containsExactly(b);
    }

    @Test
    void train_emptyData_throws() {
        assertThatThrownBy(() -> new IsolationForest().train(new double[0][], 10, 256, 42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void averagePathLength_matchesKnownValues() {
        assertThat(IsolationNode.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationNode.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationNode.averagePathLength(256)).isCloseTo(10.2448, within(1e-3));
    }
}
