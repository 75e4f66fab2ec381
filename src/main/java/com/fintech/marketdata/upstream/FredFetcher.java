package com.fintech.marketdata.upstream;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Macroeconomic series from the FRED graph CSV download.
 *
 * <p>The upstream series id is the key without the macro prefix, so
 * {@code M_CPIAUCSL} downloads {@code CPIAUCSL}. The dataset has a single column
 * named after the series; FRED's {@code "."} placeholder becomes a missing value.
 */
@Component
public class FredFetcher extends AbstractUpstreamFetcher {

    private static final String MISSING_VALUE = ".";

    private final RestTemplate restTemplate;
    private final CsvMapper csvMapper = new CsvMapper();
    private final String baseUrl;
    private final String macroPrefix;

    public FredFetcher(
            @Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
            MarketDataProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        super(circuitBreakerRegistry, meterRegistry);
        this.restTemplate = restTemplate;
        this.baseUrl = YahooFinanceFetcher.stripTrailingSlash(properties.getUpstream().getFred().getBaseUrl());
        this.macroPrefix = properties.getRouting().getMacroPrefix();
    }

    @Override
    public SourceType sourceType() {
        return SourceType.MACRO;
    }

    @Override
    protected String providerName() {
        return "FRED";
    }

    @Override
    protected String noDataMessage(SeriesKey key) {
        return "No data found for FRED series " + key;
    }

    String seriesId(SeriesKey key) {
        String value = key.value();
        if (value.startsWith(macroPrefix) && value.length() > macroPrefix.length()) {
            return value.substring(macroPrefix.length());
        }
        return value;
    }

    URI graphUri(String seriesId, LocalDate start, LocalDate end) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
            .path("/graph/fredgraph.csv")
            .queryParam("id", seriesId)
            .queryParam("cosd", start.toString())
            .queryParam("coed", end.toString())
            .encode()
            .build()
            .toUri();
    }

    @Override
    protected SeriesDataset download(SeriesKey key, LocalDate start, LocalDate end) {
        String seriesId = seriesId(key);
        String body = restTemplate.getForObject(graphUri(seriesId, start, end), String.class);

        if (body == null || body.isBlank()) {
            return SeriesDataset.empty(List.of(seriesId));
        }
        // Unknown ids are answered with an HTML error page instead of CSV
        if (body.stripLeading().startsWith("<")) {
            throw new UnknownSeriesException("FRED has no series " + seriesId);
        }

        List<String[]> rows = readRows(body);
        if (rows.isEmpty()) {
            return SeriesDataset.empty(List.of(seriesId));
        }

        String[] header = rows.get(0);
        if (header.length < 2) {
            throw new IllegalStateException("Unexpected FRED header: " + String.join(",", header));
        }
        List<String> columns = List.of(header[1].trim());

        List<Observation> observations = new ArrayList<>(rows.size() - 1);
        for (String[] row : rows.subList(1, rows.size())) {
            if (row.length < 2 || row[0].isBlank()) {
                continue;
            }
            LocalDate date = parseDate(row[0]);
            if (date.isBefore(start) || date.isAfter(end)) {
                continue;
            }
            observations.add(Observation.of(date, parseValue(row[1])));
        }
        return SeriesDataset.fromUnordered(columns, observations);
    }

    private List<String[]> readRows(String body) {
        try (MappingIterator<String[]> iterator = csvMapper
                .readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(body)) {
            return iterator.readAll();
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed FRED CSV", e);
        }
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Malformed FRED date: " + text, e);
        }
    }

    private static Double parseValue(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || MISSING_VALUE.equals(trimmed)) {
            return null;
        }
        try {
            return Double.valueOf(trimmed);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Malformed FRED value: " + text, e);
        }
    }
}
