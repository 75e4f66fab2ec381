package com.fintech.marketdata.upstream;

/**
 * Raised inside a download when the provider reports that the identifier does not exist.
 * Circuit breakers are configured to ignore it.
 */
public class UnknownSeriesException extends RuntimeException {

    public UnknownSeriesException(String message) {
        super(message);
    }
}
