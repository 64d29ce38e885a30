package com.gov.kpianalytics.engine;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * Small statistics helpers shared by the forecaster and the detectors.
 * Empty input yields NaN; a single value has a standard deviation of 0.
 */
public final class SeriesStatistics {

    private SeriesStatistics() {}

    public static double mean(double[] values) {
        return new Mean().evaluate(values);
    }

    public static double mean(double[] values, int from, int to) {
        return new Mean().evaluate(values, from, to - from);
    }

    /** Sample standard deviation (n - 1 denominator). */
    public static double sampleStd(double[] values) {
        return new StandardDeviation(true).evaluate(values);
    }

    public static double sampleStd(double[] values, int from, int to) {
        return new StandardDeviation(true).evaluate(values, from, to - from);
    }

    /** Population standard deviation (n denominator). */
    public static double populationStd(double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param q percentile in [0, 100]
     */
    public static double percentile(double[] values, double q) {
        if (values.length == 0) return Double.NaN;
        if (q <= 0) return Arrays.stream(values).min().orElse(Double.NaN);
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, Math.min(100.0, q));
    }

    /**
     * Lower weighted percentile with unit weights: the smallest value whose
     * cumulative count reaches {@code fraction * n}.
     */
    public static double lowerPercentile(double[] values, double fraction) {
        if (values.length == 0) return Double.NaN;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double target = fraction * sorted.length;
        int idx = 0;
        while (idx < sorted.length - 1 && (idx + 1) < target) {
            idx++;
        }
        return sorted[idx];
    }

    public static boolean hasNaN(double[] values) {
        for (double v : values) {
            if (Double.isNaN(v)) return true;
        }
        return false;
    }

    public static boolean hasInfinite(double[] values) {
        for (double v : values) {
            if (Double.isInfinite(v)) return true;
        }
        return false;
    }

    /** Round half-even to 4 decimals; non-finite values pass through. */
    public static double round4(double value) {
        if (!Double.isFinite(value)) return value;
        return new BigDecimal(value).setScale(4, RoundingMode.HALF_EVEN).doubleValue();
    }
}
