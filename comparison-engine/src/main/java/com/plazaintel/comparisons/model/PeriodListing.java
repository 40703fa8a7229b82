package com.plazaintel.comparisons.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Years and months offered for comparison.
 *
 * The current year is listed with whatever months exist; any other year is
 * listed only when all twelve months are present.
 */
public record PeriodListing(List<Integer> years, Map<Integer, List<Integer>> monthsPerYear) {

    public static PeriodListing of(Map<Integer, ? extends SortedSet<Integer>> monthsByYear, int currentYear) {
        Map<Integer, List<Integer>> filtered = new TreeMap<>(Collections.reverseOrder());
        monthsByYear.forEach((year, months) -> {
            if (year == currentYear || isComplete(months)) {
                filtered.put(year, List.copyOf(new TreeSet<>(months)));
            }
        });
        return new PeriodListing(new ArrayList<>(filtered.keySet()), filtered);
    }

    public static boolean isComplete(SortedSet<Integer> months) {
        for (int m = 1; m <= 12; m++) {
            if (!months.contains(m)) return false;
        }
        return true;
    }

    public boolean contains(int year) {
        return monthsPerYear.containsKey(year);
    }
}
