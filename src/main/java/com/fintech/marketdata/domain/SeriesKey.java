package com.fintech.marketdata.domain;

import java.util.Objects;

/**
 * Identifier of one cached time series: an instrument ticker (e.g. {@code AAPL})
 * or a prefixed macro metric code (e.g. {@code M_CPIAUCSL}).
 *
 * <p>The key is opaque to the cache and the lock registry; only the
 * {@link com.fintech.marketdata.routing.SourceRouter} interprets its prefix.
 *
 * @param value Trimmed, non-blank identifier
 */
public record SeriesKey(String value) {

    public SeriesKey {
        Objects.requireNonNull(value, "Series key cannot be null");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("Series key cannot be blank");
        }
    }

    public static SeriesKey of(String value) {
        return new SeriesKey(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
