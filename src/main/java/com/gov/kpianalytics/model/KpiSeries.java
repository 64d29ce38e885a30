package com.gov.kpianalytics.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only quarterly series for a single (kpi, region) pair.
 * Observations are kept in the order supplied; {@link #sorted()} returns a
 * copy ordered by (year, quarter).
 */
public final class KpiSeries {

    public static final Comparator<Observation> PERIOD_ORDER =
            Comparator.comparingInt(Observation::year).thenComparingInt(Observation::quarter);

    private final List<Observation> observations;

    private KpiSeries(List<Observation> observations) {
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
    }

    public static KpiSeries of(List<Observation> observations) {
        return new KpiSeries(observations == null ? List.of() : observations);
    }

    public static KpiSeries empty() {
        return new KpiSeries(List.of());
    }

    /**
     * Consecutive quarters starting at (startYear, startQuarter), one per value.
     */
    public static KpiSeries quarterly(int startYear, int startQuarter, double... values) {
        List<Observation> list = new ArrayList<>(values.length);
        int year = startYear;
        int quarter = startQuarter;
        for (double value : values) {
            list.add(new Observation(year, quarter, value));
            quarter++;
            if (quarter > 4) {
                quarter = 1;
                year++;
            }
        }
        return new KpiSeries(list);
    }

    public KpiSeries sorted() {
        List<Observation> copy = new ArrayList<>(observations);
        copy.sort(PERIOD_ORDER);
        return new KpiSeries(copy);
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public int size() {
        return observations.size();
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public Observation get(int index) {
        return observations.get(index);
    }

    public Observation last() {
        return observations.get(observations.size() - 1);
    }

    public double[] values() {
        double[] values = new double[observations.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = observations.get(i).value();
        }
        return values;
    }

    public int minYear() {
        return observations.stream().mapToInt(Observation::year).min().orElse(0);
    }

    public int maxYear() {
        return observations.stream().mapToInt(Observation::year).max().orElse(0);
    }

    @Override
    public String toString() {
        return "KpiSeries{size=" + observations.size() + "}";
    }
}
