package com.gov.kpianalytics.engine.forecast.tree;

public class RegressionNode {

    private int splitFeature;
    private double threshold;
    private RegressionNode left;
    private RegressionNode right;
    private double value;
    private int size;
    private boolean leaf;

    private RegressionNode() {}

    public static RegressionNode internalNode(int splitFeature, double threshold,
                                              RegressionNode left, RegressionNode right,
                                              double value, int size) {
        RegressionNode node = new RegressionNode();
        node.splitFeature = splitFeature;
        node.threshold = threshold;
        node.left = left;
        node.right = right;
        node.value = value;
        node.size = size;
        node.leaf = false;
        return node;
    }

    public static RegressionNode leafNode(double value, int size) {
        RegressionNode node = new RegressionNode();
        node.value = value;
        node.size = size;
        node.leaf = true;
        return node;
    }

    /** Leaf reached by the given point; rows equal to the threshold go left. */
    public RegressionNode leafFor(double[] point) {
        RegressionNode node = this;
        while (!node.leaf) {
            node = point[node.splitFeature] <= node.threshold ? node.left : node.right;
        }
        return node;
    }

    // Quantile boosting rewrites leaf values while fitting
    void setValue(double value) {
        this.value = value;
    }

    public int getSplitFeature() { return splitFeature; }
    public double getThreshold() { return threshold; }
    public RegressionNode getLeft() { return left; }
    public RegressionNode getRight() { return right; }
    public double getValue() { return value; }
    public int getSize() { return size; }
    public boolean isLeaf() { return leaf; }
}
