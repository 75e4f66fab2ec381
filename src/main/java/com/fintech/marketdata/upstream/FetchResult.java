package com.fintech.marketdata.upstream;

import com.fintech.marketdata.domain.SeriesDataset;

import java.util.Objects;

/**
 * Outcome of an {@link UpstreamFetcher} call: either a non-empty dataset or a typed error.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Failure {

    static FetchResult success(SeriesDataset dataset) {
        return new Success(dataset);
    }

    static FetchResult failure(FetchError error) {
        return new Failure(error);
    }

    record Success(SeriesDataset dataset) implements FetchResult {
        public Success {
            Objects.requireNonNull(dataset, "Dataset cannot be null");
            if (dataset.isEmpty()) {
                throw new IllegalArgumentException("A successful fetch must contain at least one observation");
            }
        }
    }

    record Failure(FetchError error) implements FetchResult {
        public Failure {
            Objects.requireNonNull(error, "Error cannot be null");
        }
    }
}
