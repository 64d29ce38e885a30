package com.gov.kpianalytics.engine.forecast;

import com.gov.kpianalytics.engine.SeriesStatistics;
import com.gov.kpianalytics.model.KpiSeries;

import java.util.List;

/**
 * Builds the 11-dimensional feature vector used by the forecaster.
 *
 * Features:
 *   [0]  time_idx:       (year - minYear) * 4 + quarter
 *   [1]  quarter_sin:    sin(2*pi*quarter/4)
 *   [2]  quarter_cos:    cos(2*pi*quarter/4)
 *   [3]  year_norm:      (year - minYear) / max(1, maxYear - minYear)
 *   [4]  lag_1:          value one period back
 *   [5]  lag_2:          value two periods back
 *   [6]  lag_4:          value four periods back (same quarter last year)
 *   [7]  rolling_mean_4: mean of the trailing (up to) 4 values, current included
 *   [8]  rolling_std_4:  sample std of the same window, 0 when undefined
 *   [9]  diff_1:         value - lag_1
 *   [10] diff_4:         value - lag_4
 *
 * Cells left undefined by shifting are back-filled from the first defined
 * value of their column; a column with no defined value becomes 0.
 */
public final class FeatureBuilder {

    public static final int FEATURE_COUNT = 11;

    public static final List<String> FEATURE_NAMES = List.of(
            "time_idx",
            "quarter_sin",
            "quarter_cos",
            "year_norm",
            "lag_1",
            "lag_2",
            "lag_4",
            "rolling_mean_4",
            "rolling_std_4",
            "diff_1",
            "diff_4"
    );

    static final int ROLLING_WINDOW = 4;

    private FeatureBuilder() {}

    public static double[][] build(KpiSeries series) {
        int n = series.size();
        double[][] rows = new double[n][FEATURE_COUNT];
        if (n == 0) return rows;

        int minYear = series.minYear();
        int maxYear = series.maxYear();
        double[] values = series.values();

        for (int i = 0; i < n; i++) {
            int year = series.get(i).year();
            int quarter = series.get(i).quarter();
            double[] row = rows[i];

            row[0] = timeIndex(year, quarter, minYear);
            row[1] = quarterSin(quarter);
            row[2] = quarterCos(quarter);
            row[3] = yearNorm(year, minYear, maxYear);
            row[4] = shifted(values, i, 1);
            row[5] = shifted(values, i, 2);
            row[6] = shifted(values, i, 4);

            int from = Math.max(0, i - ROLLING_WINDOW + 1);
            row[7] = SeriesStatistics.mean(values, from, i + 1);
            row[8] = SeriesStatistics.sampleStd(values, from, i + 1);

            row[9] = i >= 1 ? values[i] - values[i - 1] : Double.NaN;
            row[10] = i >= 4 ? values[i] - values[i - 4] : Double.NaN;
        }

        fillMissing(rows);
        return rows;
    }

    /**
     * Single feature row for a future period, computed from a value history
     * whose last entry is the most recent (observed or predicted) value.
     * Lags shorter than the history fall back to lag_1.
     */
    public static double[] rolloutRow(List<Double> history, int year, int quarter, int minYear, int maxYear) {
        int size = history.size();
        double lag1 = size >= 1 ? history.get(size - 1) : 0.0;
        double lag2 = size >= 2 ? history.get(size - 2) : lag1;
        double lag4 = size >= 4 ? history.get(size - 4) : lag1;

        double[] recent = size == 0
                ? new double[]{0.0}
                : history.subList(Math.max(0, size - ROLLING_WINDOW), size).stream()
                        .mapToDouble(Double::doubleValue).toArray();
        double rollingMean = SeriesStatistics.mean(recent);
        double rollingStd = SeriesStatistics.populationStd(recent);
        if (Double.isNaN(rollingStd)) rollingStd = 0.0;

        double diff1 = size >= 2 ? lag1 - lag2 : 0.0;
        double diff4 = size >= 4 ? lag1 - lag4 : 0.0;

        return new double[]{
                timeIndex(year, quarter, minYear),
                quarterSin(quarter),
                quarterCos(quarter),
                yearNorm(year, minYear, maxYear),
                lag1,
                lag2,
                lag4,
                rollingMean,
                rollingStd,
                diff1,
                diff4
        };
    }

    static double timeIndex(int year, int quarter, int minYear) {
        return (year - minYear) * 4.0 + quarter;
    }

    static double quarterSin(int quarter) {
        return Math.sin(2 * Math.PI * quarter / 4.0);
    }

    static double quarterCos(int quarter) {
        return Math.cos(2 * Math.PI * quarter / 4.0);
    }

    static double yearNorm(int year, int minYear, int maxYear) {
        return (year - minYear) / (double) Math.max(1, maxYear - minYear);
    }

    private static double shifted(double[] values, int i, int lag) {
        return i >= lag ? values[i - lag] : Double.NaN;
    }

    /** Replace any NaN or infinite cell with 0. */
    static void zeroFillNonFinite(double[][] rows) {
        for (double[] row : rows) {
            for (int j = 0; j < row.length; j++) {
                if (!Double.isFinite(row[j])) row[j] = 0.0;
            }
        }
    }

    private static void fillMissing(double[][] rows) {
        int n = rows.length;
        for (int j = 0; j < FEATURE_COUNT; j++) {
            // forward fill
            double last = Double.NaN;
            for (double[] row : rows) {
                if (Double.isNaN(row[j])) {
                    row[j] = last;
                } else {
                    last = row[j];
                }
            }
            // backward fill
            double next = Double.NaN;
            for (int i = n - 1; i >= 0; i--) {
                if (Double.isNaN(rows[i][j])) {
                    rows[i][j] = next;
                } else {
                    next = rows[i][j];
                }
            }
            for (double[] row : rows) {
                if (Double.isNaN(row[j])) row[j] = 0.0;
            }
        }
    }
}
