package com.fintech.marketdata.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fintech.marketdata.config.MarketDataProperties;
import com.fintech.marketdata.domain.Observation;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.SourceType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Daily price history for tradable instruments from the Yahoo Finance chart API.
 *
 * <p>Columns are unadjusted OHLC, the adjusted close and volume. The provider treats
 * {@code period2} as exclusive, so the request extends to the start of the day after
 * the requested end date.
 */
@Component
public class YahooFinanceFetcher extends AbstractUpstreamFetcher {

    public static final List<String> COLUMNS = List.of("Open", "High", "Low", "Close", "Adj Close", "Volume");

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public YahooFinanceFetcher(
            @Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
            MarketDataProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        super(circuitBreakerRegistry, meterRegistry);
        this.restTemplate = restTemplate;
        this.baseUrl = stripTrailingSlash(properties.getUpstream().getYahoo().getBaseUrl());
    }

    @Override
    public SourceType sourceType() {
        return SourceType.INSTRUMENT;
    }

    @Override
    protected String providerName() {
        return "Yahoo Finance";
    }

    @Override
    protected String noDataMessage(SeriesKey key) {
        return "No data found for ticker " + key;
    }

    @Override
    protected SeriesDataset download(SeriesKey key, LocalDate start, LocalDate end) {
        JsonNode body = restTemplate.getForObject(chartUri(key, start, end), JsonNode.class);
        if (body == null) {
            throw new IllegalStateException("Empty response body");
        }

        JsonNode chart = body.path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String code = error.path("code").asText("");
            String description = error.path("description").asText(code);
            if ("Not Found".equalsIgnoreCase(code)) {
                throw new UnknownSeriesException(description);
            }
            throw new IllegalStateException(code + ": " + description);
        }

        JsonNode result = chart.path("result").path(0);
        if (result.isMissingNode()) {
            return SeriesDataset.empty(COLUMNS);
        }
        return parseResult(result, start, end);
    }

    URI chartUri(SeriesKey key, LocalDate start, LocalDate end) {
        long period1 = start.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long period2 = end.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond();

        return UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/v8/finance/chart/{symbol}")
            .queryParam("period1", period1)
            .queryParam("period2", period2)
            .queryParam("interval", "1d")
            .queryParam("events", "div,splits")
            .queryParam("includeAdjustedClose", "true")
            .buildAndExpand(key.value())
            .encode()
            .toUri();
    }

    private SeriesDataset parseResult(JsonNode result, LocalDate start, LocalDate end) {
        JsonNode timestamps = result.path("timestamp");
        if (!timestamps.isArray() || timestamps.isEmpty()) {
            return SeriesDataset.empty(COLUMNS);
        }

        ZoneId zone = exchangeZone(result.path("meta"));
        JsonNode quote = result.path("indicators").path("quote").path(0);
        JsonNode adjClose = result.path("indicators").path("adjclose").path(0).path("adjclose");

        List<Observation> rows = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            LocalDate date = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            if (date.isBefore(start) || date.isAfter(end)) {
                continue;
            }

            Double open = number(quote.path("open"), i);
            Double high = number(quote.path("high"), i);
            Double low = number(quote.path("low"), i);
            Double close = number(quote.path("close"), i);
            if (open == null && high == null && low == null && close == null) {
                // Placeholder bar for a halted or not-yet-traded session
                continue;
            }

            rows.add(Observation.of(date, open, high, low, close,
                number(adjClose, i), number(quote.path("volume"), i)));
        }
        return SeriesDataset.fromUnordered(COLUMNS, rows);
    }

    private static ZoneId exchangeZone(JsonNode meta) {
        String zoneName = meta.path("exchangeTimezoneName").asText("");
        if (ZoneId.getAvailableZoneIds().contains(zoneName)) {
            return ZoneId.of(zoneName);
        }
        JsonNode offset = meta.path("gmtoffset");
        if (offset.canConvertToInt()) {
            return ZoneOffset.ofTotalSeconds(offset.asInt());
        }
        return ZoneOffset.UTC;
    }

    private static Double number(JsonNode array, int index) {
        JsonNode node = array.path(index);
        if (node.isMissingNode() || node.isNull() || !node.isNumber()) {
            return null;
        }
        return node.asDouble();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
