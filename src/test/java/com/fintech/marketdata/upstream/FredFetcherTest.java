package com.fintech.marketdata.upstream;

import com.fintech.marketdata.config.MarketDataProperties;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static com.fintech.marketdata.SeriesFixtures.date;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.queryParam;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("FredFetcher Tests")
class FredFetcherTest {

    private static final SeriesKey CPI = SeriesKey.of("M_CPIAUCSL");
    private static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

    private MockRestServiceServer server;
    private FredFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        MarketDataProperties properties = new MarketDataProperties();
        properties.getUpstream().getFred().setBaseUrl("http://fred.test");

        fetcher = new FredFetcher(restTemplate, properties, CircuitBreakerRegistry.ofDefaults(), new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Should strip the macro prefix to get the FRED series id")
    void testSeriesId() {
        assertThat(fetcher.seriesId(CPI)).isEqualTo("CPIAUCSL");
        assertThat(fetcher.seriesId(SeriesKey.of("GDP"))).isEqualTo("GDP");
        assertThat(fetcher.seriesId(SeriesKey.of("M_"))).isEqualTo("M_");
    }

    @Test
    @DisplayName("Should download the graph CSV and parse values, treating '.' as missing")
    void testParsesCsv() {
        server.expect(requestTo(startsWith("http://fred.test/graph/fredgraph.csv")))
            .andExpect(queryParam("id", "CPIAUCSL"))
            .andExpect(queryParam("cosd", "2023-01-01"))
            .andExpect(queryParam("coed", "2023-03-31"))
            .andRespond(withSuccess("""
                DATE,CPIAUCSL
                2022-12-01,298.812
                2023-01-01,300.356
                2023-02-01,.
                2023-03-01,301.836
                """, TEXT_CSV));

        FetchResult result = fetcher.fetch(CPI, date("2023-01-01"), date("2023-03-31"));

        server.verify();
        SeriesDataset dataset = ((FetchResult.Success) result).dataset();
        assertThat(dataset.columns()).containsExactly("CPIAUCSL");
        assertThat(dataset.dates()).containsExactly(date("2023-01-01"), date("2023-02-01"), date("2023-03-01"));
        assertThat(dataset.observations().get(0).value(0)).isEqualTo(300.356);
        assertThat(dataset.observations().get(1).value(0)).isNull();
    }

    @Test
    @DisplayName("Should accept the observation_date header variant")
    void testObservationDateHeader() {
        server.expect(requestTo(startsWith("http://fred.test/")))
            .andRespond(withSuccess("observation_date,UNRATE\n2023-01-01,3.4\n", TEXT_CSV));

        FetchResult result = fetcher.fetch(SeriesKey.of("M_UNRATE"), date("2023-01-01"), date("2023-01-31"));

        SeriesDataset dataset = ((FetchResult.Success) result).dataset();
        assertThat(dataset.columns()).containsExactly("UNRATE");
        assertThat(dataset.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Header-only CSV should be reported as NO_DATA")
    void testHeaderOnly() {
        server.expect(requestTo(startsWith("http://fred.test/")))
            .andRespond(withSuccess("DATE,CPIAUCSL\n", TEXT_CSV));

        FetchResult result = fetcher.fetch(CPI, date("2030-01-01"), date("2030-12-31"));

        FetchError error = ((FetchResult.Failure) result).error();
        assertThat(error.reason()).isEqualTo(FetchError.Reason.NO_DATA);
        assertThat(error.message()).isEqualTo("No data found for FRED series M_CPIAUCSL");
    }

    @Test
    @DisplayName("HTML error page should be reported as UNKNOWN_SERIES")
    void testHtmlResponse() {
        server.expect(requestTo(startsWith("http://fred.test/")))
            .andRespond(withSuccess("<!DOCTYPE html><html><body>Series not found</body></html>", MediaType.TEXT_HTML));

        FetchResult result = fetcher.fetch(SeriesKey.of("M_NOPE"), date("2023-01-01"), date("2023-01-31"));

        assertThat(((FetchResult.Failure) result).error().reason()).isEqualTo(FetchError.Reason.UNKNOWN_SERIES);
    }

    @Test
    @DisplayName("HTTP 404 should be reported as UNKNOWN_SERIES")
    void testNotFound() {
        server.expect(requestTo(startsWith("http://fred.test/"))).andRespond(withStatus(HttpStatus.NOT_FOUND));

        FetchResult result = fetcher.fetch(SeriesKey.of("M_NOPE"), date("2023-01-01"), date("2023-01-31"));

        assertThat(((FetchResult.Failure) result).error().reason()).isEqualTo(FetchError.Reason.UNKNOWN_SERIES);
    }

    @Test
    @DisplayName("Malformed values should be reported as PROVIDER_ERROR")
    void testMalformedValue() {
        server.expect(requestTo(startsWith("http://fred.test/")))
            .andRespond(withSuccess("DATE,CPIAUCSL\n2023-01-01,abc\n", TEXT_CSV));

        FetchResult result = fetcher.fetch(CPI, date("2023-01-01"), date("2023-01-31"));

        FetchError error = ((FetchResult.Failure) result).error();
        assertThat(error.reason()).isEqualTo(FetchError.Reason.PROVIDER_ERROR);
        assertThat(error.message()).startsWith("Error fetching data from FRED for M_CPIAUCSL: ");
    }

    @Test
    @DisplayName("Too many requests should be reported as PROVIDER_ERROR")
    void testRateLimited() {
        server.expect(requestTo(startsWith("http://fred.test/"))).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        FetchResult result = fetcher.fetch(CPI, date("2023-01-01"), date("2023-01-31"));

        assertThat(((FetchResult.Failure) result).error().reason()).isEqualTo(FetchError.Reason.PROVIDER_ERROR);
    }
}
