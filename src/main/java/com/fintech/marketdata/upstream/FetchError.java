package com.fintech.marketdata.upstream;

import com.fintech.marketdata.domain.SeriesKey;

import java.util.Objects;

/**
 * Typed description of a failed upstream fetch.
 *
 * @param key Series that was requested
 * @param reason Failure category
 * @param message Human-readable message, safe to return to API callers
 */
public record FetchError(SeriesKey key, Reason reason, String message) {

    public FetchError {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }

    public enum Reason {
        /** Upstream answered but returned no rows for the window. */
        NO_DATA,
        /** Upstream does not know the identifier. */
        UNKNOWN_SERIES,
        /** Network, auth, rate limiting or an unreadable payload. */
        PROVIDER_ERROR,
        /** The provider's circuit breaker is rejecting calls. */
        CIRCUIT_OPEN
    }
}
