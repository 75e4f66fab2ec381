package com.fintech.marketdata.cache;

import com.fintech.marketdata.domain.CoverageRange;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of every series fetched so far, keyed by series key.
 *
 * <p>Each entry is an immutable {@link SeriesDataset}; a merge swaps in a new instance,
 * so readers never observe a half-applied merge. The cache does not serialize
 * read-modify-write sequences on one key: callers must hold that key's lock from
 * {@link KeyLockRegistry} around {@link #needsFetch}, {@link #mergeInsert} and
 * {@link #slice}.
 *
 * <p>No eviction and no persistence: entries live for the life of the process.
 */
@Component
public class SeriesCache {

    private static final Logger log = LoggerFactory.getLogger(SeriesCache.class);

    private final ConcurrentHashMap<SeriesKey, SeriesDataset> entries = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    public SeriesCache(MeterRegistry meterRegistry) {
        meterRegistry.gauge("marketdata.cache.hits", hits);
        meterRegistry.gauge("marketdata.cache.misses", misses);
        meterRegistry.gaugeMapSize("marketdata.cache.series", Tags.empty(), entries);
    }

    /**
     * First and last cached date for the key, empty if the key was never fetched.
     */
    public Optional<CoverageRange> coveredRange(SeriesKey key) {
        SeriesDataset dataset = entries.get(key);
        return dataset == null ? Optional.empty() : dataset.coverage();
    }

    /**
     * True when the cached span does not reach both ends of the request.
     * Gaps inside the span are not considered.
     */
    public boolean needsFetch(SeriesKey key, LocalDate start, LocalDate end) {
        Optional<CoverageRange> coverage = coveredRange(key);
        boolean fetch = coverage.isEmpty() || !coverage.get().covers(start, end);
        if (fetch) {
            misses.incrementAndGet();
        } else {
            hits.incrementAndGet();
        }
        return fetch;
    }

    /**
     * Stores {@code dataset} for the key, merging with what is already cached.
     * On a date present in both, the incoming row wins.
     *
     * @return The dataset now stored for the key
     */
    public SeriesDataset mergeInsert(SeriesKey key, SeriesDataset dataset) {
        SeriesDataset merged = entries.merge(key, dataset, SeriesDataset::mergedWith);

        if (log.isDebugEnabled()) {
            log.debug("Merged {} rows into {}: now {} rows covering {}",
                dataset.size(), key, merged.size(), merged.coverage().orElse(null));
        }
        return merged;
    }

    /**
     * Cached rows with {@code start <= date <= end}. Empty when nothing falls in range
     * or the key is absent.
     */
    public SeriesDataset slice(SeriesKey key, LocalDate start, LocalDate end) {
        SeriesDataset dataset = entries.get(key);
        if (dataset == null) {
            return SeriesDataset.empty(List.of());
        }
        return dataset.slice(start, end);
    }

    public Optional<SeriesDataset> snapshot(SeriesKey key) {
        return Optional.ofNullable(entries.get(key));
    }

    /** Cached keys with their current dataset, ordered by key. */
    public Map<SeriesKey, SeriesDataset> snapshotAll() {
        Map<SeriesKey, SeriesDataset> copy = new TreeMap<>((a, b) -> a.value().compareTo(b.value()));
        copy.putAll(entries);
        return copy;
    }

    public Set<SeriesKey> keys() {
        return Set.copyOf(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }
}
