package com.gov.kpianalytics.engine.forecast.tree;

/**
 * A trained model mapping a scaled feature row to a numeric prediction.
 * Implementations are immutable once fitted.
 */
public interface Regressor {

    double predict(double[] features);

    default double[] predict(double[][] rows) {
        double[] out = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            out[i] = predict(rows[i]);
        }
        return out;
    }
}
