package com.gov.kpianalytics.engine.forecast;

import com.gov.kpianalytics.engine.SeriesStatistics;
import com.gov.kpianalytics.engine.StandardScaler;
import com.gov.kpianalytics.engine.forecast.tree.GradientBoostingRegressor;
import com.gov.kpianalytics.engine.forecast.tree.RandomForestRegressor;
import com.gov.kpianalytics.engine.forecast.tree.Regressor;
import com.gov.kpianalytics.exception.ConstantSeriesException;
import com.gov.kpianalytics.exception.DataException;
import com.gov.kpianalytics.exception.InsufficientDataException;
import com.gov.kpianalytics.exception.ModelNotFittedException;
import com.gov.kpianalytics.model.ForecastPoint;
import com.gov.kpianalytics.model.KpiSeries;
import com.gov.kpianalytics.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Quarterly KPI forecaster backed by tree ensembles.
 *
 * <p>{@code GRADIENT_BOOSTING} trains a squared-error point model plus two
 * quantile models bounding the confidence band. {@code RANDOM_FOREST} trains
 * the point model only; its band is a fixed-width interval derived from the
 * training-value spread.
 *
 * <p>Instances hold mutable fitted state and are not thread-safe. Use one
 * instance per (kpi, region) task.
 */
public class KpiForecaster {

    private static final Logger log = LoggerFactory.getLogger(KpiForecaster.class);

    public static final int MIN_FORECAST_POINTS = 4;

    static final int BOOSTING_MAX_DEPTH = 4;
    static final double BOOSTING_LEARNING_RATE = 0.1;
    static final int FOREST_MAX_DEPTH = 6;

    private final ModelType modelType;
    private final int numEstimators;
    private final double confidenceLevel;
    private final long randomState;

    private FittedForecastModel fitted;

    public KpiForecaster() {
        this(ModelType.GRADIENT_BOOSTING, 100, 0.95, 42L);
    }

    public KpiForecaster(ModelType modelType, int numEstimators, double confidenceLevel, long randomState) {
        if (confidenceLevel <= 0.0 || confidenceLevel >= 1.0) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }
        if (numEstimators < 1) {
            throw new IllegalArgumentException("numEstimators must be >= 1, got " + numEstimators);
        }
        this.modelType = modelType;
        this.numEstimators = numEstimators;
        this.confidenceLevel = confidenceLevel;
        this.randomState = randomState;
    }

    /**
     * Fit the point model (and quantile models for gradient boosting).
     *
     * @throws InsufficientDataException fewer than {@value #MIN_FORECAST_POINTS} observations
     * @throws ConstantSeriesException   all values identical
     * @throws DataException             NaN or infinite values present
     */
    public KpiForecaster fit(KpiSeries series) {
        validate(series);

        KpiSeries ordered = series.sorted();
        double[] targets = ordered.values();
        double[][] features = FeatureBuilder.build(ordered);
        FeatureBuilder.zeroFillNonFinite(features);

        StandardScaler scaler = new StandardScaler();
        double[][] scaled = scaler.fitTransform(features);

        Regressor pointModel;
        Regressor lowerModel = null;
        Regressor upperModel = null;

        if (modelType == ModelType.GRADIENT_BOOSTING) {
            double alpha = (1.0 - confidenceLevel) / 2.0;
            pointModel = GradientBoostingRegressor
                    .squaredError(numEstimators, BOOSTING_MAX_DEPTH, BOOSTING_LEARNING_RATE, randomState)
                    .fit(scaled, targets);
            lowerModel = GradientBoostingRegressor
                    .quantile(alpha, numEstimators, BOOSTING_MAX_DEPTH, BOOSTING_LEARNING_RATE, randomState)
                    .fit(scaled, targets);
            upperModel = GradientBoostingRegressor
                    .quantile(1.0 - alpha, numEstimators, BOOSTING_MAX_DEPTH, BOOSTING_LEARNING_RATE, randomState)
                    .fit(scaled, targets);
        } else {
            pointModel = new RandomForestRegressor(numEstimators, FOREST_MAX_DEPTH, randomState)
                    .fit(scaled, targets);
        }

        List<Double> history = new ArrayList<>(targets.length);
        for (double v : targets) history.add(v);

        this.fitted = FittedForecastModel.builder()
                .modelType(modelType)
                .scaler(scaler)
                .pointModel(pointModel)
                .lowerModel(lowerModel)
                .upperModel(upperModel)
                .minYear(ordered.minYear())
                .maxYear(ordered.maxYear())
                .lastYear(ordered.last().year())
                .lastQuarter(ordered.last().quarter())
                .lastFeatureRow(Arrays.copyOf(features[features.length - 1], FeatureBuilder.FEATURE_COUNT))
                .lastValue(targets[targets.length - 1])
                .history(List.copyOf(history))
                .trainingStd(SeriesStatistics.sampleStd(targets))
                .build();

        log.debug("Fitted {} forecaster on {} points ({} estimators)",
                modelType.getCode(), targets.length, numEstimators);
        return this;
    }

    private void validate(KpiSeries series) {
        if (series == null || series.size() < MIN_FORECAST_POINTS) {
            throw new InsufficientDataException(MIN_FORECAST_POINTS, series == null ? 0 : series.size());
        }
        double[] values = series.values();
        // NaN propagates through the std, so only a clean zero means constant
        if (SeriesStatistics.sampleStd(values) == 0.0) {
            throw new ConstantSeriesException();
        }
        if (SeriesStatistics.hasNaN(values)) {
            throw new DataException("Data contains NaN values. Please clean data before forecasting.");
        }
        if (SeriesStatistics.hasInfinite(values)) {
            throw new DataException("Data contains infinite values. Please clean data before forecasting.");
        }
    }

    public List<ForecastPoint> predict(int quartersAhead) {
        return predict(quartersAhead, null, null);
    }

    /**
     * Roll the model forward {@code quartersAhead} quarters.
     *
     * @param startYear    period to continue after; null means the last observed year
     * @param startQuarter period to continue after; null means the last observed quarter
     * @throws ModelNotFittedException when called before a successful fit
     */
    public List<ForecastPoint> predict(int quartersAhead, Integer startYear, Integer startQuarter) {
        if (fitted == null) {
            throw new ModelNotFittedException();
        }
        return new ForecastRollout(fitted).run(quartersAhead, startYear, startQuarter);
    }

    public boolean isFitted() {
        return fitted != null;
    }

    public FittedForecastModel getFittedModel() {
        if (fitted == null) {
            throw new ModelNotFittedException();
        }
        return fitted;
    }

    public ModelType getModelType() { return modelType; }
    public int getNumEstimators() { return numEstimators; }
    public double getConfidenceLevel() { return confidenceLevel; }
}
