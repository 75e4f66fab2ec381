package com.fintech.marketdata.upstream;

import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.domain.SourceType;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpClientErrorException;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Shared fetch flow for HTTP-backed providers.
 *
 * <p>Subclasses only implement {@link #download}. This class adds:
 * <ul>
 *   <li>precondition checks</li>
 *   <li>a Resilience4j circuit breaker named after the provider</li>
 *   <li>translation of exceptions and empty downloads into {@link FetchError}s</li>
 *   <li>a fetch latency timer tagged by provider and outcome</li>
 * </ul>
 */
public abstract class AbstractUpstreamFetcher implements UpstreamFetcher {

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    protected AbstractUpstreamFetcher(CircuitBreakerRegistry circuitBreakerRegistry, MeterRegistry meterRegistry) {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(sourceType().provider());
        this.meterRegistry = meterRegistry;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Circuit breaker '{}' state changed: {} -> {}",
                    circuitBreaker.getName(),
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    @Override
    public final FetchResult fetch(SeriesKey key, LocalDate start, LocalDate end) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(start, "Start date cannot be null");
        Objects.requireNonNull(end, "End date cannot be null");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException(
                String.format("Start date %s is after end date %s", start, end)
            );
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";

        try {
            SeriesDataset dataset = circuitBreaker.executeSupplier(() -> download(key, start, end));

            if (dataset == null || dataset.isEmpty()) {
                outcome = "no_data";
                log.info("{} returned no rows for {} [{} .. {}]", providerName(), key, start, end);
                return failure(key, FetchError.Reason.NO_DATA, noDataMessage(key));
            }

            log.info("Fetched {} rows for {} from {} [{} .. {}]",
                dataset.size(), key, providerName(), start, end);
            return FetchResult.success(dataset);

        } catch (CallNotPermittedException e) {
            outcome = "circuit_open";
            log.warn("Circuit breaker OPEN - rejecting fetch for {} from {}", key, providerName());
            return failure(key, FetchError.Reason.CIRCUIT_OPEN,
                errorMessage(key, providerName() + " is temporarily unavailable"));

        } catch (UnknownSeriesException e) {
            outcome = "unknown_series";
            log.info("{} does not know {}: {}", providerName(), key, e.getMessage());
            return failure(key, FetchError.Reason.UNKNOWN_SERIES, noDataMessage(key));

        } catch (HttpClientErrorException.NotFound e) {
            outcome = "unknown_series";
            log.info("{} answered 404 for {}", providerName(), key);
            return failure(key, FetchError.Reason.UNKNOWN_SERIES, noDataMessage(key));

        } catch (RuntimeException e) {
            outcome = "error";
            log.error("Upstream call to {} failed for {} [{} .. {}]", providerName(), key, start, end, e);
            return failure(key, FetchError.Reason.PROVIDER_ERROR, errorMessage(key, e.getMessage()));

        } finally {
            sample.stop(meterRegistry.timer("marketdata.fetch.time",
                "provider", sourceType().provider(),
                "outcome", outcome));
        }
    }

    /**
     * Performs the HTTP call and parses the payload. May return an empty dataset;
     * provider failures are thrown as runtime exceptions.
     */
    protected abstract SeriesDataset download(SeriesKey key, LocalDate start, LocalDate end);

    /** Display name used in log lines and error messages. */
    protected abstract String providerName();

    protected abstract String noDataMessage(SeriesKey key);

    protected String errorMessage(SeriesKey key, String detail) {
        return String.format("Error fetching data from %s for %s: %s", providerName(), key, detail);
    }

    CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    private static FetchResult failure(SeriesKey key, FetchError.Reason reason, String message) {
        return FetchResult.failure(new FetchError(key, reason, message));
    }
}
