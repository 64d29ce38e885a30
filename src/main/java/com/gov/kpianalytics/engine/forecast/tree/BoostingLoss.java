package com.gov.kpianalytics.engine.forecast.tree;

/** Loss optimised by {@link GradientBoostingRegressor}. */
public enum BoostingLoss {
    /** Least squares: fits the conditional mean. */
    SQUARED_ERROR,
    /** Pinball loss: fits the conditional alpha-quantile. */
    QUANTILE
}
