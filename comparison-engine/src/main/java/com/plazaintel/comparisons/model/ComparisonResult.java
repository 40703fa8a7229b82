package com.plazaintel.comparisons.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * Result of comparing two periods. Cached per (key1, key2, region filter);
 * {@code cacheHit} is set on the copy handed back to the caller.
 */
@Value
@Builder
public class ComparisonResult {

    int key1;
    int key2;
    String label1;
    String label2;

    /** Region the comparison was narrowed to, null when unfiltered */
    String appliedRegion;

    PlazaChurn plazaAnalysis;
    Map<Metric, MetricDelta> globalMetrics;

    /** Keyed by region display name, sorted */
    Map<String, RegionComparison> byRegion;

    HeadlineMetrics headline;
    Instant createdAt;

    @With
    boolean cacheHit;
}
