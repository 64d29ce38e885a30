package com.gov.kpianalytics.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StandardScalerTest {

    @Test
    void fitTransform_centersAndScalesEachColumn() {
        double[][] data = {{1, 10}, {3, 10}, {5, 10}};

        double[][] scaled = new StandardScaler().fitTransform(data);

        // column 0: mean 3, population std sqrt(8/3)
        double std = Math.sqrt(8.0 / 3.0);
        assertThat(scaled[0][0]).isCloseTo(-2 / std, within(1e-12));
        assertThat(scaled[1][0]).isCloseTo(0.0, within(1e-12));
        assertThat(scaled[2][0]).isCloseTo(2 / std, within(1e-12));
    }

    @Test
    void fit_constantColumn_mapsToZeroInsteadOfNaN() {
        StandardScaler scaler = new StandardScaler().fit(new double[][]{{1, 10}, {3, 10}});

        assertThat(scaler.getScales()[1]).isEqualTo(1.0);
        assertThat(scaler.transform(new double[]{2, 10})[1]).isEqualTo(0.0);
        assertThat(scaler.transform(new double[]{2, 12})[1]).isEqualTo(2.0);
    }

    @Test
    void transform_beforeFit_throws() {
        StandardScaler scaler = new StandardScaler();

        assertThat(scaler.isFitted()).isFalse();
        assertThatThrownBy(() -> scaler.transform(new double[]{1}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void transform_wrongWidth_throws() {
        StandardScaler scaler = new StandardScaler().fit(new double[][]{{1, 2}, {3, 4}});

        assertThatThrownBy(() -> scaler.transform(new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected 2 features");
    }

    @Test
    void fit_emptyData_throws() {
        assertThatThrownBy(() -> new StandardScaler().fit(new double[0][]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
