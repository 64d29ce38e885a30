package com.gov.kpianalytics.engine.forecast;

import com.gov.kpianalytics.engine.SeriesStatistics;
import com.gov.kpianalytics.model.ForecastPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Autoregressive multi-step forecast over a frozen {@link FittedForecastModel}.
 *
 * <p>The rollout is a fold over {@link RolloutState}: each {@link #step} advances
 * the period by one quarter, derives the feature row from the value history,
 * predicts, and returns a new state whose history ends with the prediction.
 * Later steps therefore compound on earlier forecasts rather than on ground truth.
 */
public final class ForecastRollout {

    static final double FALLBACK_Z = 1.96;
    static final double FALLBACK_STD_FACTOR = 0.5;

    private final FittedForecastModel model;

    public ForecastRollout(FittedForecastModel model) {
        this.model = model;
    }

    /**
     * Immutable rollout state: the value history (observed, then predicted)
     * and the most recently emitted period.
     */
    public record RolloutState(List<Double> history, int year, int quarter) {

        public RolloutState {
            history = Collections.unmodifiableList(new ArrayList<>(history));
        }

        RolloutState advance(double prediction) {
            List<Double> next = new ArrayList<>(history);
            next.add(prediction);
            int nextQuarter = quarter + 1;
            int nextYear = year;
            if (nextQuarter > 4) {
                nextQuarter = 1;
                nextYear++;
            }
            return new RolloutState(next, nextYear, nextQuarter);
        }
    }

    /** Result of a single step: the emitted point and the state to continue from. */
    public record Step(ForecastPoint point, RolloutState state) {}

    public RolloutState initialState(Integer startYear, Integer startQuarter) {
        int year = startYear != null ? startYear : model.getLastYear();
        int quarter = startQuarter != null ? startQuarter : model.getLastQuarter();
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("Start quarter must be between 1 and 4, got " + quarter);
        }
        return new RolloutState(model.getHistory(), year, quarter);
    }

    public List<ForecastPoint> run(int quartersAhead, Integer startYear, Integer startQuarter) {
        if (quartersAhead < 0) {
            throw new IllegalArgumentException("quartersAhead must be >= 0, got " + quartersAhead);
        }
        RolloutState state = initialState(startYear, startQuarter);
        List<ForecastPoint> points = new ArrayList<>(quartersAhead);
        for (int i = 0; i < quartersAhead; i++) {
            Step step = step(state);
            points.add(step.point());
            state = step.state();
        }
        return points;
    }

    public Step step(RolloutState state) {
        int quarter = state.quarter() + 1;
        int year = state.year();
        if (quarter > 4) {
            quarter = 1;
            year++;
        }

        double[] row = FeatureBuilder.rolloutRow(state.history(), year, quarter,
                model.getMinYear(), model.getMaxYear());
        double[] scaled = model.getScaler().transform(row);

        double prediction = model.getPointModel().predict(scaled);
        double lower;
        double upper;
        if (model.hasQuantileModels()) {
            // Independent quantile models; bounds may cross and are reported as-is
            lower = model.getLowerModel().predict(scaled);
            upper = model.getUpperModel().predict(scaled);
        } else {
            double std = model.getTrainingStd() * FALLBACK_STD_FACTOR;
            lower = prediction - FALLBACK_Z * std;
            upper = prediction + FALLBACK_Z * std;
        }

        ForecastPoint point = ForecastPoint.builder()
                .year(year)
                .quarter(quarter)
                .predictedValue(SeriesStatistics.round4(prediction))
                .confidenceLower(SeriesStatistics.round4(lower))
                .confidenceUpper(SeriesStatistics.round4(upper))
                .build();
        return new Step(point, state.advance(prediction));
    }
}
