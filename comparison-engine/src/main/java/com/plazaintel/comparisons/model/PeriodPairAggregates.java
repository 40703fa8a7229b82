package com.plazaintel.comparisons.model;

import java.util.Map;

/**
 * Per-region aggregates of the two sides of a comparison, keyed by region id.
 */
public record PeriodPairAggregates(Map<Integer, RegionAggregate> period1, Map<Integer, RegionAggregate> period2) {
}
