package com.plazaintel.comparisons.backend;

import com.plazaintel.comparisons.model.PeriodKey;
import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.RegionAggregate;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Acceleration backend that keeps each period as primitive column arrays.
 *
 * Two maps, each with its own capacity:
 *  - periods: at most {@code maxPeriods}; loading a new period into a full
 *    store drops the least recently used one
 *  - results: aggregated pairs keyed by (key1, key2, filter), at most
 *    {@link #MAX_RESULTS}, same replacement rule
 *
 * Result expiry is by idle time (last access), not creation time.
 */
@Slf4j
public class ColumnarAccelerationBackend implements AccelerationBackend {

    public static final int MAX_RESULTS = 200;

    // 7 longs + region id + overhead per row, rough figure for diagnostics
    private static final int BYTES_PER_ROW = 96;

    private final int maxPeriods;
    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Integer, ColumnarPeriod> periods = new HashMap<>();
    private final Map<ResultKey, CachedResult> results = new HashMap<>();

    public ColumnarAccelerationBackend(int maxPeriods, Clock clock) {
        this.maxPeriods = maxPeriods;
        this.clock = clock;
    }

    @Override
    public int loadPeriod(int key, List<PlazaRecord> records) {
        ColumnarPeriod columns = ColumnarPeriod.from(records, clock.millis());

        lock.writeLock().lock();
        try {
            if (periods.size() >= maxPeriods && !periods.containsKey(key)) {
                periods.entrySet().stream()
                        .min(Comparator.comparingLong(e -> e.getValue().lastAccess))
                        .map(Map.Entry::getKey)
                        .ifPresent(lru -> {
                            periods.remove(lru);
                            log.debug("Backend full ({} periods), dropped {}", maxPeriods, lru);
                        });
            }
            periods.put(key, columns);
            // results computed from the old copy are stale now
            results.keySet().removeIf(k -> k.key1 == key || k.key2 == key);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Backend loaded {}: {} rows", key, columns.size);
        return columns.size;
    }

    @Override
    public boolean isCached(int key) {
        lock.readLock().lock();
        try {
            return periods.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public PeriodPairAggregates compare(int key1, int key2, int regionFilter) {
        ResultKey resultKey = new ResultKey(key1, key2, regionFilter);
        long now = clock.millis();

        lock.writeLock().lock();
        try {
            CachedResult hit = results.get(resultKey);
            if (hit != null) {
                hit.lastAccess = now;
                hit.hits++;
                return hit.aggregates;
            }
        } finally {
            lock.writeLock().unlock();
        }

        PeriodPairAggregates computed;
        lock.readLock().lock();
        try {
            ColumnarPeriod p1 = loaded(key1);
            ColumnarPeriod p2 = loaded(key2);
            p1.lastAccess = now;
            p2.lastAccess = now;
            computed = new PeriodPairAggregates(p1.aggregate(regionFilter), p2.aggregate(regionFilter));
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (results.size() >= MAX_RESULTS && !results.containsKey(resultKey)) {
                results.entrySet().stream()
                        .min(Comparator.comparingLong(e -> e.getValue().lastAccess))
                        .map(Map.Entry::getKey)
                        .ifPresent(results::remove);
            }
            results.put(resultKey, new CachedResult(computed, now));
        } finally {
            lock.writeLock().unlock();
        }
        return computed;
    }

    @Override
    public int purgeExpiredResults(Duration ttl) {
        long now = clock.millis();
        long ttlMs = ttl.toMillis();

        lock.writeLock().lock();
        try {
            int before = results.size();
            results.values().removeIf(r -> now - r.lastAccess >= ttlMs);
            return before - results.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int evictLru(int maxPeriodsToKeep, int currentYear) {
        lock.writeLock().lock();
        try {
            List<Map.Entry<Integer, ColumnarPeriod>> historical = new ArrayList<>();
            for (Map.Entry<Integer, ColumnarPeriod> e : periods.entrySet()) {
                if (PeriodKey.year(e.getKey()) != currentYear) {
                    historical.add(e);
                }
            }
            historical.sort(Comparator.comparingLong(e -> e.getValue().lastAccess));

            int toRemove = Math.max(0, historical.size() - maxPeriodsToKeep);
            List<Integer> removed = new ArrayList<>();
            for (int i = 0; i < toRemove; i++) {
                removed.add(historical.get(i).getKey());
            }
            removed.forEach(periods::remove);
            return toRemove;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int clearResults() {
        lock.writeLock().lock();
        try {
            int n = results.size();
            results.clear();
            return n;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BackendStats stats() {
        lock.readLock().lock();
        try {
            long rows = periods.values().stream().mapToLong(p -> p.size).sum();
            long hits = results.values().stream().mapToLong(r -> r.hits).sum();
            return new BackendStats(periods.size(), rows, rows * BYTES_PER_ROW / 1024,
                    results.size(), hits, MAX_RESULTS, maxPeriods);
        } finally {
            lock.readLock().unlock();
        }
    }

    private ColumnarPeriod loaded(int key) {
        ColumnarPeriod p = periods.get(key);
        if (p == null) {
            throw new IllegalStateException("Period " + key + " not loaded in backend");
        }
        return p;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private record ResultKey(int key1, int key2, int filter) {}

    private static final class CachedResult {
        final PeriodPairAggregates aggregates;
        volatile long lastAccess;
        volatile long hits;

        CachedResult(PeriodPairAggregates aggregates, long now) {
            this.aggregates = aggregates;
            this.lastAccess = now;
            this.hits = 1;
        }
    }

    private static final class ColumnarPeriod {
        static final int NO_REGION = Integer.MIN_VALUE;

        final int size;
        final int[] regionIds;
        final long[] inscriptions;
        final long[] attendances;
        final long[] certTotal;
        final long[] certInitial;
        final long[] certPrimary;
        final long[] certSecondary;
        volatile long lastAccess;

        private ColumnarPeriod(int size, long now) {
            this.size = size;
            this.regionIds = new int[size];
            this.inscriptions = new long[size];
            this.attendances = new long[size];
            this.certTotal = new long[size];
            this.certInitial = new long[size];
            this.certPrimary = new long[size];
            this.certSecondary = new long[size];
            this.lastAccess = now;
        }

        static ColumnarPeriod from(List<PlazaRecord> records, long now) {
            ColumnarPeriod c = new ColumnarPeriod(records.size(), now);
            for (int i = 0; i < c.size; i++) {
                PlazaRecord r = records.get(i);
                c.regionIds[i] = r.getRegionId() == null ? NO_REGION : r.getRegionId();
                c.inscriptions[i] = r.getInscriptions();
                c.attendances[i] = r.getAttendances();
                c.certTotal[i] = r.effectiveCertificationTotal();
                c.certInitial[i] = r.getCertificationInitial();
                c.certPrimary[i] = r.getCertificationPrimary();
                c.certSecondary[i] = r.getCertificationSecondary();
            }
            return c;
        }

        Map<Integer, RegionAggregate> aggregate(int regionFilter) {
            Map<Integer, long[]> acc = new HashMap<>();
            for (int i = 0; i < size; i++) {
                int region = regionIds[i];
                if (region == NO_REGION) continue;
                if (regionFilter != ALL_REGIONS && region != regionFilter) continue;

                long[] e = acc.computeIfAbsent(region, k -> new long[7]);
                e[0] += 1;
                e[1] += Math.max(0, inscriptions[i]);
                e[2] += Math.max(0, attendances[i]);
                e[3] += Math.max(0, certInitial[i]);
                e[4] += Math.max(0, certPrimary[i]);
                e[5] += Math.max(0, certSecondary[i]);
                e[6] += Math.max(0, certTotal[i]);
            }

            Map<Integer, RegionAggregate> out = new TreeMap<>();
            acc.forEach((region, e) -> out.put(region,
                    new RegionAggregate(region, e[0], e[1], e[2], e[3], e[4], e[5], e[6])));
            return out;
        }
    }
}
