package com.plazaintel.comparisons.scheduler;

import lombok.extern.slf4j.Slf4j;

/**
 * Terminates the JVM immediately. The supervisor (container runtime,
 * systemd) is expected to restart the service.
 */
@Slf4j
public class ProcessExitShutdownStrategy implements ShutdownStrategy {

    static final int EXIT_CODE = 1;

    @Override
    public void shutdown(String reason) {
        log.error("Hard shutdown: {}", reason);
        System.exit(EXIT_CODE);
    }
}
