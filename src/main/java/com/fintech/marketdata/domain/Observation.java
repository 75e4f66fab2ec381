package com.fintech.marketdata.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row of a series: a calendar date and the values of the series' columns,
 * in column order. A value is {@code null} when the provider reported it as missing.
 *
 * @param date Observation date
 * @param values Field values aligned with {@link SeriesDataset#columns()}
 */
public record Observation(LocalDate date, List<Double> values) {

    public Observation {
        Objects.requireNonNull(date, "Observation date cannot be null");
        Objects.requireNonNull(values, "Observation values cannot be null");
        // List.copyOf rejects nulls, and missing values are legitimate here
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Observation of(LocalDate date, Double... values) {
        List<Double> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new Observation(date, list);
    }

    public Double value(int column) {
        return values.get(column);
    }

    public int width() {
        return values.size();
    }
}
