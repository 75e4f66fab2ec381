package com.fintech.marketdata.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date span of a cached series, from its first to its last row.
 *
 * <p>Gaps inside the span are not tracked: a range "covers" a request when it
 * starts on or before the requested start and ends on or after the requested end.
 *
 * @param start First observation date
 * @param end Last observation date
 */
public record CoverageRange(LocalDate start, LocalDate end) {

    public CoverageRange {
        Objects.requireNonNull(start, "Coverage start cannot be null");
        Objects.requireNonNull(end, "Coverage end cannot be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                "Coverage start (" + start + ") cannot be after end (" + end + ")"
            );
        }
    }

    public boolean covers(LocalDate from, LocalDate to) {
        return !from.isBefore(start) && !to.isAfter(end);
    }
}
