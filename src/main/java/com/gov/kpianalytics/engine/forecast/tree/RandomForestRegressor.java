package com.gov.kpianalytics.engine.forecast.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Bagged regression trees. Each tree sees a bootstrap sample of the rows and
 * considers every feature at every split; the forest predicts the mean of its trees.
 */
public class RandomForestRegressor implements Regressor {

    private final int numEstimators;
    private final int maxDepth;
    private final long seed;

    private List<RegressionTree> trees = List.of();

    public RandomForestRegressor(int numEstimators, int maxDepth, long seed) {
        if (numEstimators < 1) {
            throw new IllegalArgumentException("numEstimators must be >= 1, got " + numEstimators);
        }
        this.numEstimators = numEstimators;
        this.maxDepth = maxDepth;
        this.seed = seed;
    }

    public RandomForestRegressor fit(double[][] data, double[] targets) {
        int n = data.length;
        if (n == 0 || n != targets.length) {
            throw new IllegalArgumentException("Feature rows and targets must be non-empty and aligned");
        }
        Random random = new Random(seed);
        List<RegressionTree> fitted = new ArrayList<>(numEstimators);
        for (int t = 0; t < numEstimators; t++) {
            int[] bootstrap = new int[n];
            for (int i = 0; i < n; i++) {
                bootstrap[i] = random.nextInt(n);
            }
            fitted.add(RegressionTree.fit(data, targets, bootstrap, maxDepth, random));
        }
        this.trees = List.copyOf(fitted);
        return this;
    }

    @Override
    public double predict(double[] features) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Regressor has not been fitted");
        }
        double sum = 0.0;
        for (RegressionTree tree : trees) {
            sum += tree.predict(features);
        }
        return sum / trees.size();
    }

    public int getNumEstimators() { return numEstimators; }
    public int getMaxDepth() { return maxDepth; }
    public List<RegressionTree> getTrees() { return trees; }
}
