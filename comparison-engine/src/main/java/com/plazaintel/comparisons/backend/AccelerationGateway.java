package com.plazaintel.comparisons.backend;

import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.PlazaRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Single entry point to the optional acceleration backend.
 *
 * Every call is wrapped: a missing backend or a failing one yields the
 * "nothing there" answer and a WARN log, never an exception.
 */
@Slf4j
@RequiredArgsConstructor
public class AccelerationGateway {

    /** Null when running without a backend. */
    private final AccelerationBackend backend;

    public static AccelerationGateway disabled() {
        return new AccelerationGateway(null);
    }

    public boolean isPresent() {
        return backend != null;
    }

    public boolean isCached(int key) {
        if (backend == null) return false;
        try {
            return backend.isCached(key);
        } catch (RuntimeException e) {
            log.warn("Backend isCached({}) failed: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * True only when the backend answered and said it does not hold the key.
     * A failing backend is not taken as evidence that the period is gone.
     */
    public boolean reportsMissing(int key) {
        if (backend == null) return false;
        try {
            return !backend.isCached(key);
        } catch (RuntimeException e) {
            log.warn("Backend isCached({}) failed during sync: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Copy a period into the backend.
     *
     * @return true if the backend now holds it
     */
    public boolean mirror(int key, List<PlazaRecord> records) {
        if (backend == null) return false;
        try {
            int rows = backend.loadPeriod(key, records);
            log.debug("Mirrored {} into backend: {} rows", key, rows);
            return true;
        } catch (RuntimeException e) {
            log.warn("Backend loadPeriod({}) failed: {}", key, e.getMessage());
            return false;
        }
    }

    public Optional<PeriodPairAggregates> compare(int key1, int key2) {
        if (backend == null) return Optional.empty();
        try {
            return Optional.of(backend.compare(key1, key2, AccelerationBackend.ALL_REGIONS));
        } catch (RuntimeException e) {
            log.warn("Backend compare({}, {}) failed, falling back to in-memory: {}", key1, key2, e.getMessage());
            return Optional.empty();
        }
    }

    public int purgeExpiredResults(Duration ttl) {
        if (backend == null) return 0;
        try {
            return backend.purgeExpiredResults(ttl);
        } catch (RuntimeException e) {
            log.warn("Backend purgeExpiredResults failed: {}", e.getMessage());
            return 0;
        }
    }

    public int evictLru(int maxPeriods, int currentYear) {
        if (backend == null) return 0;
        try {
            return backend.evictLru(maxPeriods, currentYear);
        } catch (RuntimeException e) {
            log.warn("Backend evictLru failed: {}", e.getMessage());
            return 0;
        }
    }

    public int clearResults() {
        if (backend == null) return 0;
        try {
            return backend.clearResults();
        } catch (RuntimeException e) {
            log.warn("Backend clearResults failed: {}", e.getMessage());
            return 0;
        }
    }

    public Optional<BackendStats> stats() {
        if (backend == null) return Optional.empty();
        try {
            return Optional.of(backend.stats());
        } catch (RuntimeException e) {
            log.warn("Backend stats failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
