package com.fintech.marketdata.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable, date-ordered series of observations sharing one column schema.
 *
 * <p>Invariants enforced at construction:
 * <ul>
 *   <li>observations are strictly ascending by date (no duplicate dates)</li>
 *   <li>every observation has exactly one value per column</li>
 * </ul>
 *
 * <p>Because instances never change, the cache can hand the stored dataset to
 * readers and to the backup pipeline without copying.
 *
 * @param columns Column names in value order (the date column is implicit)
 * @param observations Rows, ascending by date
 */
public record SeriesDataset(List<String> columns, List<Observation> observations) {

    public SeriesDataset {
        columns = List.copyOf(Objects.requireNonNull(columns, "Columns cannot be null"));
        observations = List.copyOf(Objects.requireNonNull(observations, "Observations cannot be null"));

        LocalDate previous = null;
        for (Observation observation : observations) {
            if (observation.width() != columns.size()) {
                throw new IllegalArgumentException(
                    "Observation on " + observation.date() + " has " + observation.width()
                        + " values but the series has " + columns.size() + " columns"
                );
            }
            if (previous != null && !observation.date().isAfter(previous)) {
                throw new IllegalArgumentException(
                    "Observations must be strictly ascending by date: " + observation.date()
                        + " follows " + previous
                );
            }
            previous = observation.date();
        }
    }

    public static SeriesDataset empty(List<String> columns) {
        return new SeriesDataset(columns, List.of());
    }

    /**
     * Builds a dataset from rows in any order. Later rows win over earlier rows
     * with the same date.
     */
    public static SeriesDataset fromUnordered(List<String> columns, List<Observation> rows) {
        Map<LocalDate, Observation> byDate = new TreeMap<>();
        for (Observation row : rows) {
            byDate.put(row.date(), row);
        }
        return new SeriesDataset(columns, new ArrayList<>(byDate.values()));
    }

    public boolean isEmpty() {
        return observations.isEmpty();
    }

    public int size() {
        return observations.size();
    }

    /**
     * Span from the first to the last row, empty when the dataset has no rows.
     */
    public Optional<CoverageRange> coverage() {
        if (observations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CoverageRange(
            observations.get(0).date(),
            observations.get(observations.size() - 1).date()
        ));
    }

    /**
     * Combines this dataset with newer rows: concatenate, keep the newer row on a
     * date collision, re-sort ascending.
     *
     * @param newer Rows fetched after this dataset was built
     * @return Merged dataset (this instance is unchanged)
     * @throws IllegalStateException if the two datasets use different columns
     */
    public SeriesDataset mergedWith(SeriesDataset newer) {
        if (!columns.equals(newer.columns())) {
            throw new IllegalStateException(
                "Cannot merge series with columns " + newer.columns() + " into " + columns
            );
        }
        List<Observation> combined = new ArrayList<>(observations.size() + newer.size());
        combined.addAll(observations);
        combined.addAll(newer.observations());
        return fromUnordered(columns, combined);
    }

    /**
     * Rows with {@code from <= date <= to}, in ascending order.
     */
    public SeriesDataset slice(LocalDate from, LocalDate to) {
        if (from.isAfter(to) || observations.isEmpty()) {
            return empty(columns);
        }
        int lo = lowerBound(from);
        int hi = upperBound(to);
        if (lo >= hi) {
            return empty(columns);
        }
        return new SeriesDataset(columns, observations.subList(lo, hi));
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(observations.size());
        for (Observation observation : observations) {
            dates.add(observation.date());
        }
        return Collections.unmodifiableList(dates);
    }

    // First index whose date is > the given date
    private int upperBound(LocalDate date) {
        int lo = 0;
        int hi = observations.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (observations.get(mid).date().isAfter(date)) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    // First index whose date is >= the given date
    private int lowerBound(LocalDate date) {
        int lo = 0;
        int hi = observations.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (observations.get(mid).date().isBefore(date)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
