package com.plazaintel.comparisons.backend;

import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.PlazaRecord;

import java.time.Duration;
import java.util.List;

/**
 * Optional accelerated store for period data.
 *
 * Holds its own copy of each period and its own result cache, with its own
 * TTL/LRU bookkeeping. The engine works without one; callers go through
 * {@link AccelerationGateway}, which turns any failure here into a fallback.
 */
public interface AccelerationBackend {

    /** Sentinel for "no region filter". */
    int ALL_REGIONS = -1;

    /**
     * Load (or replace) a period.
     *
     * @return number of rows loaded
     */
    int loadPeriod(int key, List<PlazaRecord> records);

    boolean isCached(int key);

    /**
     * Aggregate both periods by region.
     *
     * @param regionFilter region id to keep, or {@link #ALL_REGIONS}
     * @throws IllegalStateException if either period is not loaded
     */
    PeriodPairAggregates compare(int key1, int key2, int regionFilter);

    /** @return number of cached results removed */
    int purgeExpiredResults(Duration ttl);

    /**
     * Drop least recently used periods outside {@code currentYear} until at
     * most {@code maxPeriods} of them remain.
     *
     * @return number of periods removed
     */
    int evictLru(int maxPeriods, int currentYear);

    /** Drop every cached result. */
    int clearResults();

    BackendStats stats();
}
