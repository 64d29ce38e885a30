package com.gov.kpianalytics.engine.forecast;

import com.gov.kpianalytics.model.KpiSeries;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureBuilderTest {

    private static final KpiSeries SERIES = KpiSeries.quarterly(2022, 1, 10, 20, 30, 40, 50);

    @Test
    void build_producesOneRowPerObservation() {
        double[][] rows = FeatureBuilder.build(SERIES);

        assertThat(rows).hasNumberOfRows(5);
        assertThat(rows[0]).hasSize(FeatureBuilder.FEATURE_COUNT);
        assertThat(FeatureBuilder.FEATURE_NAMES).hasSize(FeatureBuilder.FEATURE_COUNT);
    }

    @Test
    void build_calendarFeatures() {
        double[][] rows = FeatureBuilder.build(SERIES);

        // 2023Q1
        double[] last = rows[4];
        assertThat(last[0]).isEqualTo(5.0);
        assertThat(last[1]).isCloseTo(1.0, within(1e-12));
        assertThat(last[2]).isCloseTo(0.0, within(1e-12));
        assertThat(last[3]).isEqualTo(1.0);
        assertThat(rows[0][3]).isEqualTo(0.0);
    }

    @Test
    void build_lagAndRollingFeatures() {
        double[] last = FeatureBuilder.build(SERIES)[4];

        assertThat(last[4]).isEqualTo(40.0);
        assertThat(last[5]).isEqualTo(30.0);
        assertThat(last[6]).isEqualTo(10.0);
        assertThat(last[7]).isEqualTo(35.0);
        assertThat(last[8]).isCloseTo(12.909944, within(1e-6));
        assertThat(last[9]).isEqualTo(10.0);
        assertThat(last[10]).isEqualTo(40.0);
    }

    @Test
    void build_leadingGapsAreBackFilled() {
        double[] first = FeatureBuilder.build(SERIES)[0];

        assertThat(first[4]).isEqualTo(10.0);   // lag_1 from row 1
        assertThat(first[5]).isEqualTo(10.0);   // lag_2 from row 2
        assertThat(first[6]).isEqualTo(10.0);   // lag_4 from row 4
        assertThat(first[7]).isEqualTo(10.0);
        assertThat(first[8]).isEqualTo(0.0);
        assertThat(first[9]).isEqualTo(10.0);
        assertThat(first[10]).isEqualTo(40.0);
    }

    @Test
    void build_columnWithNoDefinedValue_becomesZero() {
        double[][] rows = FeatureBuilder.build(KpiSeries.quarterly(2022, 1, 1, 2, 4, 8));

        for (double[] row : rows) {
            assertThat(row[6]).isEqualTo(0.0);
            assertThat(row[10]).isEqualTo(0.0);
        }
    }

    @Test
    void build_emptySeries_returnsNoRows() {
        assertThat(FeatureBuilder.build(KpiSeries.empty())).isEmpty();
    }

    @Test
    void rolloutRow_usesHistoryTailAndPopulationStd() {
        double[] row = FeatureBuilder.rolloutRow(List.of(10.0, 20.0, 30.0, 40.0, 50.0), 2023, 2, 2022, 2023);

        assertThat(row[0]).isEqualTo(6.0);
        assertThat(row[4]).isEqualTo(50.0);
        assertThat(row[5]).isEqualTo(40.0);
        assertThat(row[6]).isEqualTo(20.0);
        assertThat(row[7]).isEqualTo(35.0);
        assertThat(row[8]).isCloseTo(Math.sqrt(125.0), within(1e-9));
        assertThat(row[9]).isEqualTo(10.0);
        assertThat(row[10]).isEqualTo(30.0);
    }

    @Test
    void rolloutRow_shortHistory_fallsBackToLastValue() {
        double[] row = FeatureBuilder.rolloutRow(List.of(7.0), 2025, 1, 2024, 2024);

        assertThat(row[4]).isEqualTo(7.0);
        assertThat(row[5]).isEqualTo(7.0);
        assertThat(row[6]).isEqualTo(7.0);
        assertThat(row[8]).isEqualTo(0.0);
        assertThat(row[9]).isEqualTo(0.0);
        assertThat(row[10]).isEqualTo(0.0);
    }

    @Test
    void rolloutRow_beyondTrainingYears_yearNormExceedsOne() {
        double[] row = FeatureBuilder.rolloutRow(List.of(1.0, 2.0), 2026, 1, 2022, 2024);

        assertThat(row[0]).isEqualTo(17.0);
        assertThat(row[3]).isEqualTo(2.0);
    }

    @Test
    void zeroFillNonFinite_replacesNaNAndInfinity() {
        double[][] rows = {{Double.NaN, 1.0, Double.POSITIVE_INFINITY}};

        FeatureBuilder.zeroFillNonFinite(rows);

        assertThat(rows[0]).containsExactly(0.0, 1.0, 0.0);
    }
}
