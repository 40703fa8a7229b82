package com.plazaintel.comparisons.scheduler;

import com.plazaintel.comparisons.service.LocalDatasetLoader;
import com.plazaintel.comparisons.service.PeriodStore;
import com.plazaintel.comparisons.service.RemoteIndex;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Startup and shutdown of the period cache:
 *  1. load the remote index manifest
 *  2. read the local dataset and index it as protected periods
 *  3. start the watchdog
 *
 * A missing manifest or dataset leaves the service up with less data.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PeriodCacheBootstrap {

    private final RemoteIndex remoteIndex;
    private final LocalDatasetLoader localDatasetLoader;
    private final PeriodStore store;
    private final CacheWatchdog watchdog;

    @PostConstruct
    public void onStartup() {
        if (!remoteIndex.reload()) {
            log.warn("Remote index not loaded; only local periods will be available");
        }

        try {
            int indexed = store.indexProtected(localDatasetLoader.load());
            log.info("Startup: {} protected periods from {}", indexed, localDatasetLoader.path());
        } catch (Exception e) {
            log.error("Startup: could not index local dataset {}: {}", localDatasetLoader.path(), e.getMessage(), e);
        }

        watchdog.start();
    }

    @PreDestroy
    public void onShutdown() {
        watchdog.stop();
    }
}
