package com.plazaintel.comparisons.backend;

import com.plazaintel.comparisons.model.Period;
import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.RegionAggregate;

import java.util.Map;

/**
 * Computes per-region aggregates for periods the caller already holds. Chosen
 * once at startup; the engine never checks which implementation it got.
 */
public interface AggregationBackend {

    /** Aggregates of one period, keyed by region id. */
    Map<Integer, RegionAggregate> aggregate(Period period);

    /** Aggregates of two periods, unfiltered. */
    PeriodPairAggregates aggregatePair(Period period1, Period period2);

    String name();
}
