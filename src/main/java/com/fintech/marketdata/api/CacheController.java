package com.fintech.marketdata.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.marketdata.backup.BackupDispatcher;
import com.fintech.marketdata.cache.KeyLockRegistry;
import com.fintech.marketdata.cache.SeriesCache;
import com.fintech.marketdata.domain.CoverageRange;
import com.fintech.marketdata.domain.SeriesDataset;
import com.fintech.marketdata.domain.SeriesKey;
import com.fintech.marketdata.routing.SourceRouter;
import com.fintech.marketdata.service.SeriesQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the series cache for operators.
 */
@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Monitoring", description = "Cache contents and counters")
public class CacheController {

    private final SeriesCache cache;
    private final KeyLockRegistry locks;
    private final SourceRouter router;
    private final BackupDispatcher backupDispatcher;
    private final SeriesQueryService queryService;

    public CacheController(
            SeriesCache cache,
            KeyLockRegistry locks,
            SourceRouter router,
            BackupDispatcher backupDispatcher,
            SeriesQueryService queryService) {
        this.cache = cache;
        this.locks = locks;
        this.router = router;
        this.backupDispatcher = backupDispatcher;
        this.queryService = queryService;
    }

    @Operation(summary = "List cached series with their covered date span")
    @GetMapping("/series")
    public ResponseEntity<List<CachedSeries>> listSeries() {
        Map<SeriesKey, SeriesDataset> entries = cache.snapshotAll();
        List<CachedSeries> series = new ArrayList<>(entries.size());

        entries.forEach((key, dataset) -> {
            CoverageRange coverage = dataset.coverage().orElse(null);
            series.add(new CachedSeries(
                key.value(),
                router.classify(key).name(),
                coverage != null ? coverage.start() : null,
                coverage != null ? coverage.end() : null,
                dataset.size()
            ));
        });
        return ResponseEntity.ok(series);
    }

    @Operation(summary = "Cache, fetch and backup counters")
    @GetMapping("/metrics")
    public ResponseEntity<CacheMetrics> getMetrics() {
        return ResponseEntity.ok(new CacheMetrics(
            cache.size(),
            cache.getHits(),
            cache.getMisses(),
            queryService.getFetches(),
            queryService.getFetchFailures(),
            locks.size(),
            backupDispatcher.isEnabled(),
            backupDispatcher.getDispatched(),
            backupDispatcher.getSucceeded(),
            backupDispatcher.getFailed(),
            backupDispatcher.getDropped()
        ));
    }

    @Schema(description = "One cached series")
    public record CachedSeries(
        @JsonProperty("asset_id") String assetId,
        String source,
        LocalDate start,
        LocalDate end,
        int rows
    ) {}

    @Schema(description = "Counters since process start")
    public record CacheMetrics(
        int seriesCached,
        long cacheHits,
        long cacheMisses,
        long upstreamFetches,
        long upstreamFailures,
        int locksRegistered,
        boolean backupsEnabled,
        long backupsDispatched,
        long backupsSucceeded,
        long backupsFailed,
        long backupsDropped
    ) {}
}
