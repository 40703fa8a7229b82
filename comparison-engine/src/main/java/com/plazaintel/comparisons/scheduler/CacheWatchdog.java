package com.plazaintel.comparisons.scheduler;

import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.config.ComparisonProperties;
import com.plazaintel.comparisons.service.ComparisonResultCache;
import com.plazaintel.comparisons.service.PeriodStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Year;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background housekeeping for the period and result caches.
 *
 * Every cycle:
 *  1. purge expired comparison results (engine cache and backend)
 *  2. drop historical periods the backend no longer holds
 *  3. sample memory; below the warn threshold, stop here
 *  4. evict least recently used historical periods from backend and store
 *  5. sample again; at or above the kill threshold, shut the process down
 *
 * Protected periods are never touched. Interval defaults to 30 s.
 */
@Slf4j
@RequiredArgsConstructor
public class CacheWatchdog {

    private static final long MB = 1024L * 1024L;

    public record CycleReport(
            int purgedResults,
            int purgedBackendResults,
            int syncRemoved,
            long usedBytes,
            int evictedBackend,
            int evictedStore,
            long usedBytesAfter,
            boolean shutdownRequested) {

        static CycleReport skipped() {
            return new CycleReport(0, 0, 0, 0, 0, 0, 0, false);
        }
    }

    private final PeriodStore store;
    private final ComparisonResultCache resultCache;
    private final AccelerationGateway backend;
    private final MemorySampler memory;
    private final ShutdownStrategy shutdown;
    private final ComparisonProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Cache watchdog started (every {} ms, warn {} MB, kill {} MB)",
                    properties.getWatchdog().getIntervalMs(),
                    properties.getWatchdog().getRamWarn().toMegabytes(),
                    properties.getWatchdog().getRamKill().toMegabytes());
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Cache watchdog stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedDelayString = "${comparisons.watchdog.interval-ms:30000}",
               initialDelayString = "${comparisons.watchdog.interval-ms:30000}")
    public void scheduledCycle() {
        if (!running.get()) return;
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Watchdog cycle failed: {}", e.getMessage(), e);
        }
    }

    public CycleReport runCycle() {
        if (!running.get()) return CycleReport.skipped();

        var ttl = properties.getCache().getResultTtl();
        int purged = resultCache.purgeExpired(ttl);
        int purgedBackend = backend.purgeExpiredResults(ttl);
        if (purged + purgedBackend > 0) {
            log.info("Watchdog: purged {} expired results ({} in backend)", purged, purgedBackend);
        }

        int syncRemoved = store.syncWithBackend();

        long used = memory.usedBytes();
        long warn = properties.getWatchdog().getRamWarn().toBytes();
        log.debug("Watchdog: memory {} MB (warn at {} MB)", used / MB, warn / MB);
        if (used < warn) {
            return new CycleReport(purged, purgedBackend, syncRemoved, used, 0, 0, used, false);
        }

        int maxHistorical = properties.getCache().getMaxHistoricalPeriods();
        int currentYear = Year.now(clock).getValue();
        log.warn("Watchdog: memory high ({} MB ≥ {} MB), evicting historical periods down to {}",
                used / MB, warn / MB, maxHistorical);

        int evictedBackend = backend.evictLru(maxHistorical, currentYear);
        int evictedStore = store.evictLru(maxHistorical);

        long after = memory.usedBytes();
        long kill = properties.getWatchdog().getRamKill().toBytes();
        log.info("Watchdog: evicted {} from store, {} from backend; memory now {} MB",
                evictedStore, evictedBackend, after / MB);

        boolean shutdownRequested = false;
        if (after >= kill) {
            String reason = String.format("memory %d MB at or above kill threshold %d MB after eviction",
                    after / MB, kill / MB);
            if (properties.getWatchdog().isHardKillEnabled()) {
                shutdownRequested = true;
                shutdown.shutdown(reason);
            } else {
                log.error("Watchdog: {} (hard kill disabled)", reason);
            }
        }
        return new CycleReport(purged, purgedBackend, syncRemoved, used,
                evictedBackend, evictedStore, after, shutdownRequested);
    }
}
