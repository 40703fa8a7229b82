package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.backend.AggregationBackend;
import com.plazaintel.comparisons.model.ComparisonResult;
import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.PeriodKey;
import com.plazaintel.comparisons.model.PeriodListing;
import com.plazaintel.comparisons.model.YearComparisonResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operations the host application calls: make a period resident, compare,
 * list, clear, reload and report status.
 */
@Slf4j
@RequiredArgsConstructor
public class ComparisonService {

    private final ComparisonEngine engine;
    private final PeriodFetcher fetcher;
    private final PeriodStore store;
    private final ComparisonResultCache resultCache;
    private final RemoteIndex remoteIndex;
    private final AccelerationGateway backend;
    private final AggregationBackend aggregation;

    public EnsureResult ensurePeriod(String year, String month) {
        int key = PeriodKey.encode(year, month);
        EnsureResult result = fetcher.ensure(key);
        log.info("ensure_period {} → {}", PeriodKey.indexLabel(key), result.reason());
        return result;
    }

    public ComparisonResult compare(String year1, String month1, String year2, String month2, String regionFilter) {
        int key1 = PeriodKey.encode(year1, month1);
        int key2 = PeriodKey.encode(year2, month2);
        return engine.compare(key1, key2, regionFilter);
    }

    public YearComparisonResult compareYears(String year1, String year2) {
        return engine.compareYears(
                PeriodKey.parseComponent(year1, "year"),
                PeriodKey.parseComponent(year2, "year"));
    }

    public PeriodListing periodsAvailable() {
        return engine.periodsAvailable();
    }

    /**
     * Drop every cached comparison and every historical period.
     * Protected periods stay resident.
     */
    public Map<String, Object> clearCaches() {
        int results = resultCache.clear();
        int backendResults = backend.clearResults();
        int periods = store.clearHistorical();
        log.info("Caches cleared: {} results, {} backend results, {} historical periods",
                results, backendResults, periods);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("results", results);
        out.put("backendResults", backendResults);
        out.put("historicalPeriods", periods);
        return out;
    }

    public Map<String, Object> reloadIndex() {
        boolean loaded = remoteIndex.reload();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("loaded", loaded);
        out.put("entries", remoteIndex.size());
        return out;
    }

    public Map<String, Object> status() {
        PeriodStore.Snapshot snapshot = store.snapshot();

        Map<String, Object> periods = new LinkedHashMap<>();
        periods.put("resident", snapshot.resident());
        periods.put("protected", snapshot.protectedCount());
        periods.put("historical", snapshot.historical());
        periods.put("rows", snapshot.rows());
        periods.put("protectedKeys", store.protectedKeys().stream().sorted().map(PeriodKey::indexLabel).toList());

        Map<String, Object> results = new LinkedHashMap<>();
        results.put("cached", resultCache.size());
        results.put("ttlSeconds", resultCache.ttl().toSeconds());
        results.put("entries", resultCache.entries());

        Map<String, Object> index = new LinkedHashMap<>();
        index.put("loaded", remoteIndex.isLoaded());
        index.put("entries", remoteIndex.size());

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("aggregation", aggregation.name());
        out.put("periods", periods);
        out.put("results", results);
        out.put("remoteIndex", index);
        backend.stats().ifPresent(stats -> out.put("backend", stats));
        return out;
    }
}
