package com.fintech.marketdata.service;

import com.fintech.marketdata.backup.BackupDispatcher;
import com.fintech.marketdata.cache.KeyLock;
import com.fintech.marketdata.cache.KeyLockRegistry;
import com.fintech.marketdata.cache.SeriesCache;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.routing.SourceRouter;
import com.fintech.marketdata.upstream.FetchError;
import com.fintech.marketdata.upstream.FetchResult;
import com.fintech.marketdata.upstream.UpstreamFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves date-range queries from the cache, fetching from upstream when the cached
 * span does not reach the requested bounds.
 *
 * <p>Per query:
 * <ol>
 *   <li>validate the range (nothing is locked or fetched for an invalid one)</li>
 *   <li>take the key's lock</li>
 *   <li>if the cache does not cover the range, fetch the full requested window and merge it</li>
 *   <li>after a merge, queue a backup of the merged series (not awaited)</li>
 *   <li>slice the cache to the requested range</li>
 *   <li>release the lock</li>
 * </ol>
 *
 * <p>Queries for the same key are serialized end to end; queries for different keys
 * never wait on each other.
 */
@Service
public class SeriesQueryService {

    private static final Logger log = LoggerFactory.getLogger(SeriesQueryService.class);
    // yyyy-MM-dd with exactly four year digits and no sign
    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
        .appendValue(ChronoField.YEAR, 4)
        .appendLiteral('-')
        .appendValue(ChronoField.MONTH_OF_YEAR, 2)
        .appendLiteral('-')
        .appendValue(ChronoField.DAY_OF_MONTH, 2)
        .toFormatter()
        .withResolverStyle(ResolverStyle.STRICT);

    private final SeriesCache cache;
    private final KeyLockRegistry locks;
    private final SourceRouter router;
    private final BackupDispatcher backupDispatcher;
    private final MeterRegistry meterRegistry;

    private final AtomicLong fetches = new AtomicLong(0);
    private final AtomicLong fetchFailures = new AtomicLong(0);

    public SeriesQueryService(
            SeriesCache cache,
            KeyLockRegistry locks,
            SourceRouter router,
            BackupDispatcher backupDispatcher,
            MeterRegistry meterRegistry) {
        this.cache = cache;
        this.locks = locks;
        this.router = router;
        this.backupDispatcher = backupDispatcher;
        this.meterRegistry = meterRegistry;

        meterRegistry.gauge("marketdata.fetch.count", fetches);
        meterRegistry.gauge("marketdata.fetch.failures", fetchFailures);
    }

    /**
     * Query with dates given as {@code yyyy-MM-dd} text.
     *
     * @throws InvalidRangeException if the asset id is blank, a date does not parse, or start is after end
     * @throws UpstreamException if the range had to be fetched and the fetch failed
     * @throws NoDataException if no cached row falls inside the range
     */
    public SeriesQueryResult query(String assetId, String startDate, String endDate) {
        return query(assetId, parseDate(startDate), parseDate(endDate));
    }

    /**
     * Query with parsed dates, both bounds inclusive.
     *
     * @throws InvalidRangeException if the asset id is blank or start is after end
     * @throws UpstreamException if the range had to be fetched and the fetch failed
     * @throws NoDataException if no cached row falls inside the range
     */
    public SeriesQueryResult query(String assetId, LocalDate start, LocalDate end) {
        SeriesKey key = validate(assetId, start, end);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "hit";

        try (KeyLock ignored = locks.acquire(key)) {
            boolean fetched = false;

            if (cache.needsFetch(key, start, end)) {
                outcome = "fetch";
                SeriesDataset merged = fetchAndMerge(key, start, end);
                fetched = true;
                backupDispatcher.dispatch(key, merged);
            } else {
                log.debug("Cache hit for {} [{} .. {}]", key, start, end);
            }

            SeriesDataset slice = cache.slice(key, start, end);
            if (slice.isEmpty()) {
                outcome = "no_data";
                throw new NoDataException(key, start, end);
            }

            log.debug("Query {} [{} .. {}] -> {} rows (fetched={})", key, start, end, slice.size(), fetched);
            return new SeriesQueryResult(key, slice, fetched);

        } catch (UpstreamException e) {
            outcome = "upstream_error";
            throw e;

        } catch (InterruptedException e) {
            outcome = "interrupted";
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the lock on " + key, e);

        } finally {
            sample.stop(meterRegistry.timer("marketdata.query.time", "outcome", outcome));
        }
    }

    private SeriesDataset fetchAndMerge(SeriesKey key, LocalDate start, LocalDate end) {
        UpstreamFetcher fetcher = router.route(key);
        fetches.incrementAndGet();
        log.info("Fetching {} [{} .. {}] from {} (cached: {})",
            key, start, end, router.classify(key).provider(), cache.coveredRange(key).orElse(null));

        FetchResult result = fetcher.fetch(key, start, end);

        if (result instanceof FetchResult.Failure failure) {
            fetchFailures.incrementAndGet();
            FetchError error = failure.error();
            log.warn("Fetch failed for {} [{} .. {}]: {} - {}", key, start, end, error.reason(), error.message());
            throw new UpstreamException(error);
        }

        SeriesDataset fetched = ((FetchResult.Success) result).dataset();
        return cache.mergeInsert(key, fetched);
    }

    private static LocalDate parseDate(String text) {
        if (text == null) {
            throw new InvalidRangeException("start_date and end_date are required");
        }
        try {
            return LocalDate.parse(text.trim(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new InvalidRangeException("Invalid date format. Use YYYY-MM-DD.");
        }
    }

    private static SeriesKey validate(String assetId, LocalDate start, LocalDate end) {
        if (assetId == null || assetId.isBlank()) {
            throw new InvalidRangeException("asset_id cannot be blank");
        }
        if (start == null || end == null) {
            throw new InvalidRangeException("start_date and end_date are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidRangeException("start_date must be before end_date");
        }
        return SeriesKey.of(assetId);
    }

    public long getFetches() {
        return fetches.get();
    }

    public long getFetchFailures() {
        return fetchFailures.get();
    }

    /**
     * Request rejected before any lock or fetch: bad dates, inverted range or blank key.
     */
    public static class InvalidRangeException extends RuntimeException {
        public InvalidRangeException(String message) {
            super(message);
        }
    }

    /**
     * Upstream fetch failed. The cache is left as it was.
     */
    public static class UpstreamException extends RuntimeException {
        private final FetchError error;

        public UpstreamException(FetchError error) {
            super(error.message());
            this.error = error;
        }

        public FetchError getError() {
            return error;
        }
    }

    /**
     * The series is available but has no row inside the requested range.
     */
    public static class NoDataException extends RuntimeException {
        private final SeriesKey key;
        private final LocalDate start;
        private final LocalDate end;

        public NoDataException(SeriesKey key, LocalDate start, LocalDate end) {
            super("No data found for the specified range.");
            this.key = key;
            this.start = start;
            this.end = end;
        }

        public SeriesKey getKey() {
            return key;
        }

        public LocalDate getStart() {
            return start;
        }

        public LocalDate getEnd() {
            return end;
        }
    }
}
