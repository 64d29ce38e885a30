package com.gov.kpianalytics.engine;

import java.util.Arrays;

/**
 * Zero-mean / unit-variance column scaler. Columns with zero variance keep a
 * scale of 1 so constant features map to 0 instead of NaN.
 */
public class StandardScaler {

    private double[] means;
    private double[] scales;

    public StandardScaler fit(double[][] data) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot fit scaler on empty data");
        }
        int cols = data[0].length;
        means = new double[cols];
        scales = new double[cols];
        double[] column = new double[data.length];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
            }
            means[j] = SeriesStatistics.mean(column);
            double std = SeriesStatistics.populationStd(column);
            scales[j] = (std == 0.0 || Double.isNaN(std)) ? 1.0 : std;
        }
        return this;
    }

    public double[][] fitTransform(double[][] data) {
        return fit(data).transform(data);
    }

    public double[][] transform(double[][] data) {
        double[][] out = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            out[i] = transform(data[i]);
        }
        return out;
    }

    public double[] transform(double[] row) {
        if (means == null) {
            throw new IllegalStateException("Scaler has not been fitted");
        }
        if (row.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length + " features, got " + row.length);
        }
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - means[j]) / scales[j];
        }
        return out;
    }

    public boolean isFitted() {
        return means != null;
    }

    public double[] getMeans() { return means == null ? null : Arrays.copyOf(means, means.length); }
    public double[] getScales() { return scales == null ? null : Arrays.copyOf(scales, scales.length); }
}
