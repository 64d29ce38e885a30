package com.gov.kpianalytics.model;

/**
 * One quarterly data point of a KPI series.
 */
public record Observation(int year, int quarter, double value) {

    public Observation {
        if (quarter < 1 || quarter > 4) {
            throw new IllegalArgumentException("Quarter must be between 1 and 4, got " + quarter);
        }
    }

    public static Observation of(int year, int quarter, double value) {
        return new Observation(year, quarter, value);
    }
}
