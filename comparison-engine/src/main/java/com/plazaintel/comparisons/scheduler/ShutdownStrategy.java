package com.plazaintel.comparisons.scheduler;

/**
 * What the watchdog does when memory stays above the kill threshold after
 * eviction.
 */
@FunctionalInterface
public interface ShutdownStrategy {

    void shutdown(String reason);
}
