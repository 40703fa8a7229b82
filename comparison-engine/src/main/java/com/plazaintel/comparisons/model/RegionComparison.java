package com.plazaintel.comparisons.model;

import java.util.Map;

public record RegionComparison(
        int regionId,
        String regionName,
        long plazasPeriod1,
        long plazasPeriod2,
        Map<Metric, MetricDelta> metrics) {
}
