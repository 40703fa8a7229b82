package com.plazaintel.comparisons.model;

import java.util.List;
import java.util.Map;

/**
 * Totals of one year, summed over the months that were resident.
 */
public record YearSummary(
        int year,
        List<Integer> months,
        long totalPlazas,
        Map<Metric, Long> metrics,
        boolean complete) {
}
