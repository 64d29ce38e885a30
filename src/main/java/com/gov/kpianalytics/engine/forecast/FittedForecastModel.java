package com.gov.kpianalytics.engine.forecast;

import com.gov.kpianalytics.engine.StandardScaler;
import com.gov.kpianalytics.engine.forecast.tree.Regressor;
import com.gov.kpianalytics.model.ModelType;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Frozen result of {@link KpiForecaster#fit}. Holds everything the rollout
 * needs; nothing in here changes after construction.
 */
@Getter
@Builder
public class FittedForecastModel {

    private final ModelType modelType;
    private final StandardScaler scaler;
    private final Regressor pointModel;
    private final Regressor lowerModel;
    private final Regressor upperModel;

    // Training-time year bounds; rollout features stay anchored to these
    private final int minYear;
    private final int maxYear;

    private final int lastYear;
    private final int lastQuarter;
    private final double[] lastFeatureRow;
    private final double lastValue;
    private final List<Double> history;

    // Sample std of the training targets, used by the fallback interval
    private final double trainingStd;

    public boolean hasQuantileModels() {
        return lowerModel != null && upperModel != null;
    }
}
