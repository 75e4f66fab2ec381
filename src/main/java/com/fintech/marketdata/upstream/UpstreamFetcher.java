package com.fintech.marketdata.upstream;

import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.SourceType;

import java.time.LocalDate;

/**
 * Contract for downloading a date window of one series from an upstream provider.
 *
 * <p>Implementations must be thread-safe: fetches for different keys run concurrently.
 * They never retry on their own and never throw for provider-side problems; those
 * come back as {@link FetchResult.Failure}.
 */
public interface UpstreamFetcher {

    /**
     * Which family of keys this fetcher serves.
     */
    SourceType sourceType();

    /**
     * Downloads observations for {@code key} between {@code start} and {@code end}.
     *
     * <p>On success the dataset is non-empty and ascending by date. The provider may
     * return rows slightly outside the window; merging is idempotent to overlap.
     *
     * @param key Series to fetch
     * @param start First date wanted (inclusive)
     * @param end Last date wanted (inclusive)
     * @return Dataset or typed failure, never null
     * @throws IllegalArgumentException if {@code start} is after {@code end}
     */
    FetchResult fetch(SeriesKey key, LocalDate start, LocalDate end);
}
