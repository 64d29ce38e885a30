package com.gov.kpianalytics.engine.forecast.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomForestRegressorTest {

    private static final double[][] X = {{1}, {2}, {3}, {4}, {5}, {6}, {7}, {8}};
    private static final double[] Y = {10, 12, 11, 13, 30, 32, 31, 33};

    @Test
    void predict_staysWithinTargetRange() {
        RandomForestRegressor forest = new RandomForestRegressor(50, 6, 42).fit(X, Y);

        for (double probe : new double[]{-100, 0, 4.5, 8, 1000}) {
            assertThat(forest.predict(new double[]{probe})).isBetween(10.0, 33.0);
        }
        assertThat(forest.getTrees()).hasSize(50);
    }

    @Test
    void predict_separatesTheTwoRegimes() {
        RandomForestRegressor forest = new RandomForestRegressor(100, 6, 42).fit(X, Y);

        assertThat(forest.predict(new double[]{1.5})).isLessThan(forest.predict(new double[]{7.5}));
    }

    @Test
    void fit_sameSeed_isDeterministic() {
        double a = new RandomForestRegressor(20, 6, 3).fit(X, Y).predict(new double[]{4.5});
        double b = new RandomForestRegressor(20, 6, 3).fit(X, Y).predict(new double[]{4.5});

        assertThat(a).isEqualTo(b);
    }

    @Test
    void predict_beforeFit_throws() {
        assertThatThrownBy(() -> new RandomForestRegressor(5, 6, 1).predict(new double[]{1}))
                .isInstanceOf(IllegalStateException.class);
    }
}
