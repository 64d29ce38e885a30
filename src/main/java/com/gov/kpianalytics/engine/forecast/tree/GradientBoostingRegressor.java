package com.gov.kpianalytics.engine.forecast.tree;

import com.gov.kpianalytics.engine.SeriesStatistics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Gradient-boosted regression trees.
 *
 * <p>Each stage fits a {@link RegressionTree} to the negative gradient of the
 * loss at the current prediction and adds it, shrunk by the learning rate.
 * For {@link BoostingLoss#QUANTILE} the initial prediction is the alpha
 * percentile of the targets, the gradient is {@code alpha} where the target
 * lies above the prediction and {@code alpha - 1} elsewhere, and every leaf is
 * re-valued to the alpha percentile of the residuals that land in it.
 */
public class GradientBoostingRegressor implements Regressor {

    private final BoostingLoss loss;
    private final double alpha;
    private final int numEstimators;
    private final int maxDepth;
    private final double learningRate;
    private final long seed;

    private double initialPrediction;
    private List<RegressionTree> trees = List.of();

    public GradientBoostingRegressor(BoostingLoss loss, double alpha, int numEstimators,
                                     int maxDepth, double learningRate, long seed) {
        if (numEstimators < 1) {
            throw new IllegalArgumentException("numEstimators must be >= 1, got " + numEstimators);
        }
        if (loss == BoostingLoss.QUANTILE && (alpha <= 0.0 || alpha >= 1.0)) {
            throw new IllegalArgumentException("Quantile alpha must be in (0, 1), got " + alpha);
        }
        this.loss = loss;
        this.alpha = alpha;
        this.numEstimators = numEstimators;
        this.maxDepth = maxDepth;
        this.learningRate = learningRate;
        this.seed = seed;
    }

    public static GradientBoostingRegressor squaredError(int numEstimators, int maxDepth,
                                                         double learningRate, long seed) {
        return new GradientBoostingRegressor(BoostingLoss.SQUARED_ERROR, 0.0,
                numEstimators, maxDepth, learningRate, seed);
    }

    public static GradientBoostingRegressor quantile(double alpha, int numEstimators, int maxDepth,
                                                     double learningRate, long seed) {
        return new GradientBoostingRegressor(BoostingLoss.QUANTILE, alpha,
                numEstimators, maxDepth, learningRate, seed);
    }

    public GradientBoostingRegressor fit(double[][] data, double[] targets) {
        int n = data.length;
        if (n == 0 || n != targets.length) {
            throw new IllegalArgumentException("Feature rows and targets must be non-empty and aligned");
        }

        initialPrediction = loss == BoostingLoss.QUANTILE
                ? SeriesStatistics.lowerPercentile(targets, alpha)
                : SeriesStatistics.mean(targets);

        double[] current = new double[n];
        Arrays.fill(current, initialPrediction);

        Random random = new Random(seed);
        List<RegressionTree> fitted = new ArrayList<>(numEstimators);
        double[] gradient = new double[n];

        for (int m = 0; m < numEstimators; m++) {
            for (int i = 0; i < n; i++) {
                gradient[i] = negativeGradient(targets[i], current[i]);
            }

            RegressionTree tree = RegressionTree.fit(data, gradient, maxDepth, random);
            if (loss == BoostingLoss.QUANTILE) {
                updateLeavesToQuantile(tree, data, targets, current);
            }

            for (int i = 0; i < n; i++) {
                current[i] += learningRate * tree.predict(data[i]);
            }
            fitted.add(tree);
        }

        this.trees = List.copyOf(fitted);
        return this;
    }

    private double negativeGradient(double target, double prediction) {
        if (loss == BoostingLoss.QUANTILE) {
            return target > prediction ? alpha : alpha - 1.0;
        }
        return target - prediction;
    }

    private void updateLeavesToQuantile(RegressionTree tree, double[][] data,
                                        double[] targets, double[] current) {
        Map<RegressionNode, List<Double>> residualsByLeaf = new IdentityHashMap<>();
        for (int i = 0; i < data.length; i++) {
            residualsByLeaf.computeIfAbsent(tree.leafFor(data[i]), k -> new ArrayList<>())
                    .add(targets[i] - current[i]);
        }
        for (Map.Entry<RegressionNode, List<Double>> entry : residualsByLeaf.entrySet()) {
            double[] residuals = entry.getValue().stream().mapToDouble(Double::doubleValue).toArray();
            entry.getKey().setValue(SeriesStatistics.lowerPercentile(residuals, alpha));
        }
    }

    @Override
    public double predict(double[] features) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Regressor has not been fitted");
        }
        double prediction = initialPrediction;
        for (RegressionTree tree : trees) {
            prediction += learningRate * tree.predict(features);
        }
        return prediction;
    }

    public BoostingLoss getLoss() { return loss; }
    public double getAlpha() { return alpha; }
    public int getNumEstimators() { return numEstimators; }
    public int getMaxDepth() { return maxDepth; }
    public double getLearningRate() { return learningRate; }
    public double getInitialPrediction() { return initialPrediction; }
    public List<RegressionTree> getTrees() { return trees; }
}
