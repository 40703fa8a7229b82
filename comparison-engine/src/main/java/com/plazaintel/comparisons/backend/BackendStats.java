package com.plazaintel.comparisons.backend;

/**
 * Diagnostics reported by an acceleration backend for the status endpoint.
 */
public record BackendStats(
        int periodsLoaded,
        long totalRows,
        long dataKb,
        int cachedResults,
        long cacheHitsTotal,
        int maxResults,
        int maxPeriods) {
}
