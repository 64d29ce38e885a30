package com.gov.kpianalytics.engine.isolationforest;

import java.util.Random;

/**
 * One random partitioning tree. Splits pick a random feature and a uniform
 * threshold between that feature's min and max; a node whose chosen feature
 * is constant becomes a leaf.
 */
public class IsolationTree {

    private final IsolationNode root;

    private IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] sample, int maxDepth, Random random) {
        return new IsolationTree(buildNode(sample, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;
        if (depth >= maxDepth || n <= 1) {
            return IsolationNode.externalNode(n);
        }

        int featureIdx = random.nextInt(data[0].length);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : data) {
            min = Math.min(min, row[featureIdx]);
            max = Math.max(max, row[featureIdx]);
        }
        if (min >= max) {
            return IsolationNode.externalNode(n);
        }

        double splitValue = min + random.nextDouble() * (max - min);

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }
        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        return IsolationNode.internalNode(featureIdx, splitValue,
                buildNode(leftData, depth + 1, maxDepth, random),
                buildNode(rightData, depth + 1, maxDepth, random));
    }

    public double pathLength(double[] point) {
        return root.pathLength(point, 0);
    }

    public IsolationNode getRoot() { return root; }
}
