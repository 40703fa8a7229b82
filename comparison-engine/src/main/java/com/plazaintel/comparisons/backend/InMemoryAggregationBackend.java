package com.plazaintel.comparisons.backend;

import com.plazaintel.comparisons.model.Period;
import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.RegionAggregate;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregates straight from the rows of the given period snapshots.
 * Rows without a region id are skipped.
 */
public class InMemoryAggregationBackend implements AggregationBackend {

    @Override
    public Map<Integer, RegionAggregate> aggregate(Period period) {
        return aggregate(period.getRecords());
    }

    @Override
    public PeriodPairAggregates aggregatePair(Period period1, Period period2) {
        return new PeriodPairAggregates(aggregate(period1), aggregate(period2));
    }

    @Override
    public String name() {
        return "in-memory";
    }

    public static Map<Integer, RegionAggregate> aggregate(List<PlazaRecord> records) {
        Map<Integer, RegionAggregate> byRegion = new TreeMap<>();
        for (PlazaRecord row : records) {
            Integer region = row.getRegionId();
            if (region == null) continue;
            byRegion.merge(region, RegionAggregate.empty(region).plus(row), RegionAggregate::plus);
        }
        return byRegion;
    }
}
