package com.gov.kpianalytics.engine.forecast.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * CART regression tree with squared-error splitting.
 *
 * A node becomes a leaf when it reaches {@code maxDepth}, holds fewer than two
 * samples, has constant targets, or no split leaves at least one sample on each
 * side. Candidate thresholds are midpoints between consecutive distinct values.
 * The order in which features are tried is shuffled per node, so among equally
 * good splits the first one found in that order wins.
 */
public class RegressionTree implements Regressor {

    private static final int MIN_SAMPLES_SPLIT = 2;
    private static final int MIN_SAMPLES_LEAF = 1;
    private static final double EPSILON = 1e-12;

    private final RegressionNode root;
    private final List<RegressionNode> leaves;

    private RegressionTree(RegressionNode root, List<RegressionNode> leaves) {
        this.root = root;
        this.leaves = leaves;
    }

    public static RegressionTree fit(double[][] data, double[] targets, int maxDepth, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < indices.length; i++) indices[i] = i;
        return fit(data, targets, indices, maxDepth, random);
    }

    /**
     * @param indices rows to train on; may contain repeats (bootstrap samples)
     */
    public static RegressionTree fit(double[][] data, double[] targets, int[] indices,
                                     int maxDepth, Random random) {
        if (indices.length == 0) {
            throw new IllegalArgumentException("Cannot fit a tree on zero samples");
        }
        List<RegressionNode> leaves = new ArrayList<>();
        RegressionNode root = buildNode(data, targets, indices, 0, maxDepth, random, leaves);
        return new RegressionTree(root, leaves);
    }

    private static RegressionNode buildNode(double[][] data, double[] targets, int[] indices,
                                            int depth, int maxDepth, Random random,
                                            List<RegressionNode> leaves) {
        int n = indices.length;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (int idx : indices) {
            double t = targets[idx];
            sum += t;
            min = Math.min(min, t);
            max = Math.max(max, t);
        }
        double mean = sum / n;

        if (depth >= maxDepth || n < MIN_SAMPLES_SPLIT || max - min <= EPSILON) {
            return leaf(mean, n, leaves);
        }

        int numFeatures = data[0].length;
        int[] featureOrder = shuffledFeatures(numFeatures, random);

        double parentProxy = sum * sum / n;
        double bestProxy = parentProxy + EPSILON;
        int bestFeature = -1;
        double bestThreshold = 0.0;

        Integer[] sorted = new Integer[n];
        for (int f : featureOrder) {
            for (int i = 0; i < n; i++) sorted[i] = indices[i];
            final int feature = f;
            Arrays.sort(sorted, Comparator.comparingDouble(idx -> data[idx][feature]));

            double leftSum = 0.0;
            for (int i = 1; i < n; i++) {
                leftSum += targets[sorted[i - 1]];
                double prev = data[sorted[i - 1]][feature];
                double curr = data[sorted[i]][feature];
                if (curr <= prev) continue;
                if (i < MIN_SAMPLES_LEAF || n - i < MIN_SAMPLES_LEAF) continue;

                double rightSum = sum - leftSum;
                double proxy = leftSum * leftSum / i + rightSum * rightSum / (n - i);
                if (proxy > bestProxy) {
                    bestProxy = proxy;
                    bestFeature = feature;
                    double threshold = prev / 2.0 + curr / 2.0;
                    bestThreshold = (threshold >= curr) ? prev : threshold;
                }
            }
        }

        if (bestFeature < 0) {
            return leaf(mean, n, leaves);
        }

        int leftCount = 0;
        for (int idx : indices) {
            if (data[idx][bestFeature] <= bestThreshold) leftCount++;
        }
        int[] leftIdx = new int[leftCount];
        int[] rightIdx = new int[n - leftCount];
        int li = 0, ri = 0;
        for (int idx : indices) {
            if (data[idx][bestFeature] <= bestThreshold) {
                leftIdx[li++] = idx;
            } else {
                rightIdx[ri++] = idx;
            }
        }

        RegressionNode left = buildNode(data, targets, leftIdx, depth + 1, maxDepth, random, leaves);
        RegressionNode right = buildNode(data, targets, rightIdx, depth + 1, maxDepth, random, leaves);
        return RegressionNode.internalNode(bestFeature, bestThreshold, left, right, mean, n);
    }

    private static RegressionNode leaf(double value, int size, List<RegressionNode> leaves) {
        RegressionNode node = RegressionNode.leafNode(value, size);
        leaves.add(node);
        return node;
    }

    private static int[] shuffledFeatures(int numFeatures, Random random) {
        int[] order = new int[numFeatures];
        for (int i = 0; i < numFeatures; i++) order[i] = i;
        // Fisher-Yates
        for (int i = numFeatures - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        return order;
    }

    @Override
    public double predict(double[] features) {
        return root.leafFor(features).getValue();
    }

    public RegressionNode leafFor(double[] features) {
        return root.leafFor(features);
    }

    public List<RegressionNode> getLeaves() {
        return leaves;
    }

    public RegressionNode getRoot() {
        return root;
    }

    public int depth() {
        return depth(root);
    }

    private static int depth(RegressionNode node) {
        if (node.isLeaf()) return 0;
        return 1 + Math.max(depth(node.getLeft()), depth(node.getRight()));
    }
}
