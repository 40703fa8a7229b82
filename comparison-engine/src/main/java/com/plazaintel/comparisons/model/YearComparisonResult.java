package com.plazaintel.comparisons.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class YearComparisonResult {

    int year1;
    int year2;
    YearSummary summary1;
    YearSummary summary2;
    Map<Metric, MetricDelta> globalMetrics;
    Map<String, RegionComparison> byRegion;

    /** e.g. "2023 incomplete: 6 of 12 months" */
    List<String> notes;
}
