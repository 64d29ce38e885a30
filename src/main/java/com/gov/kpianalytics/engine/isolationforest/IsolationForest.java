package com.gov.kpianalytics.engine.isolationforest;

import com.gov.kpianalytics.engine.SeriesStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

public class IsolationForest {

    public static final int DEFAULT_MAX_SAMPLES = 256;

    private List<IsolationTree> trees = List.of();
    private int sampleSize;

    /**
     * Train the forest.
     *
     * @param data       rows to partition, each a feature vector
     * @param numTrees   number of trees
     * @param maxSamples sub-sample size per tree; capped at the number of rows
     * @param seed       random seed
     */
    public IsolationForest train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero rows");
        }
        this.sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));

        Random random = new Random(seed);
        List<IsolationTree> built = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            built.add(IsolationTree.build(subsample(data, sampleSize, random), maxDepth, random));
        }
        this.trees = List.copyOf(built);
        return this;
    }

    /**
     * s(x, n) = 2^(-E(h(x)) / c(n)), in (0, 1]. Values near 1 are easy to isolate;
     * values well below 0.5 are deep inside the data.
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] data) {
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            scores[i] = anomalyScore(data[i]);
        }
        return scores;
    }

    /**
     * Label each row: true when its score lies strictly above the
     * (1 - contamination) percentile of all scores, so roughly a
     * {@code contamination} fraction of rows are flagged. Ties at the
     * threshold stay inliers, which keeps identical rows unflagged.
     */
    public boolean[] outliers(double[][] data, double contamination) {
        double[] scores = anomalyScores(data);
        double threshold = SeriesStatistics.percentile(scores, 100.0 * (1.0 - contamination));
        boolean[] labels = new boolean[data.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = scores[i] > threshold;
        }
        return labels;
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // partial Fisher-Yates over row indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
