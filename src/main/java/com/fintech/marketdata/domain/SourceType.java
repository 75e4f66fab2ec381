package com.fintech.marketdata.domain;

/**
 * Upstream family a series key belongs to.
 */
public enum SourceType {

    /** Macroeconomic series served by FRED. */
    MACRO("fred"),

    /** Tradable instrument history served by Yahoo Finance. */
    INSTRUMENT("yahoo-finance");

    private final String provider;

    SourceType(String provider) {
        this.provider = provider;
    }

    /**
     * Short provider name, used for metric tags and circuit breaker names.
     */
    public String provider() {
        return provider;
    }
}
