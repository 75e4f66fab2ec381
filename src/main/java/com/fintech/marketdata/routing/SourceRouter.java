package com.fintech.marketdata.routing;

import com.fintech.marketdata.config.MarketDataProperties;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.SourceType;
import com.fintech.marketdata.upstream.FredFetcher;
import com.fintech.marketdata.upstream.UpstreamFetcher;
import com.fintech.marketdata.upstream.YahooFinanceFetcher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps a series key to the upstream that serves it.
 * Keys starting with the macro prefix go to FRED, everything else to Yahoo Finance.
 */
@Component
public class SourceRouter {

    private final String macroPrefix;
    private final UpstreamFetcher instrumentFetcher;
    private final UpstreamFetcher macroFetcher;

    @Autowired
    public SourceRouter(
            MarketDataProperties properties,
            YahooFinanceFetcher instrumentFetcher,
            FredFetcher macroFetcher) {
        this(properties.getRouting().getMacroPrefix(), instrumentFetcher, macroFetcher);
    }

    public SourceRouter(String macroPrefix, UpstreamFetcher instrumentFetcher, UpstreamFetcher macroFetcher) {
        if (macroPrefix == null || macroPrefix.isEmpty()) {
            throw new IllegalArgumentException("Macro prefix cannot be empty");
        }
        this.macroPrefix = macroPrefix;
        this.instrumentFetcher = instrumentFetcher;
        this.macroFetcher = macroFetcher;
    }

    public SourceType classify(SeriesKey key) {
        return key.value().startsWith(macroPrefix) ? SourceType.MACRO : SourceType.INSTRUMENT;
    }

    public UpstreamFetcher route(SeriesKey key) {
        return switch (classify(key)) {
            case MACRO -> macroFetcher;
            case INSTRUMENT -> instrumentFetcher;
        };
    }
}
