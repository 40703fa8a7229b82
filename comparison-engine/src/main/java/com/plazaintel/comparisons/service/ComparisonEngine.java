package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.backend.AggregationBackend;
import com.plazaintel.comparisons.model.ComparisonResult;
import com.plazaintel.comparisons.model.EnsureResult;
import com.plazaintel.comparisons.model.HeadlineMetrics;
import com.plazaintel.comparisons.model.Metric;
import com.plazaintel.comparisons.model.MetricDelta;
import com.plazaintel.comparisons.model.Period;
import com.plazaintel.comparisons.model.PeriodKey;
import com.plazaintel.comparisons.model.PeriodListing;
import com.plazaintel.comparisons.model.PeriodPairAggregates;
import com.plazaintel.comparisons.model.PlazaChurn;
import com.plazaintel.comparisons.model.RegionAggregate;
import com.plazaintel.comparisons.model.RegionComparison;
import com.plazaintel.comparisons.model.YearComparisonResult;
import com.plazaintel.comparisons.model.YearSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Answers period-vs-period and year-vs-year comparisons.
 *
 * Period comparisons are cached per (key1, key2, region filter) in the
 * {@link ComparisonResultCache}. Year comparisons are not cached; they sum
 * whatever months of each year can be made resident.
 */
@Slf4j
@RequiredArgsConstructor
public class ComparisonEngine {

    private static final Set<String> NO_FILTER = Set.of("", "all", "todos");
    static final String EVICTED = "evicted_before_read";

    private final PeriodStore store;
    private final PeriodFetcher fetcher;
    private final AggregationBackend aggregation;
    private final ComparisonResultCache resultCache;
    private final RemoteIndex remoteIndex;
    private final Clock clock;

    // ── Period comparison ────────────────────────────────────────────────────

    /**
     * Compare two periods. Months may be given as "6", "06" or "6.0".
     *
     * @throws com.plazaintel.comparisons.model.InvalidPeriodException before any I/O
     * @throws PeriodUnavailableException if either period cannot be made resident
     */
    public ComparisonResult compare(int year1, String month1, int year2, String month2, String regionFilter) {
        int key1 = PeriodKey.encode(String.valueOf(year1), month1);
        int key2 = PeriodKey.encode(String.valueOf(year2), month2);
        return compare(key1, key2, regionFilter);
    }

    public ComparisonResult compare(int key1, int key2, String regionFilter) {
        String filter = normaliseFilter(regionFilter);
        ComparisonResultCache.Key cacheKey = new ComparisonResultCache.Key(key1, key2, filter);

        var cached = resultCache.get(cacheKey);
        if (cached.isPresent()) {
            log.debug("Result cache hit for {} vs {} [{}]", key1, key2, filter);
            return cached.get().withCacheHit(true);
        }

        Period period1 = requireResident(key1);
        Period period2 = requireResident(key2);

        PeriodPairAggregates pair = aggregation.aggregatePair(period1, period2);

        Map<Integer, String> names = new HashMap<>(period2.getRegionNames());
        names.putAll(period1.getRegionNames());

        Map<Integer, RegionAggregate> agg1 = pair.period1();
        Map<Integer, RegionAggregate> agg2 = pair.period2();
        String appliedRegion = null;

        if (!filter.isEmpty()) {
            Integer regionId = resolveRegion(filter, names);
            if (regionId == null) {
                log.info("Region filter '{}' matches no region, comparing unfiltered", regionFilter);
            } else {
                agg1 = onlyRegion(agg1, regionId);
                agg2 = onlyRegion(agg2, regionId);
                appliedRegion = names.get(regionId);
            }
        }

        RegionAggregate total1 = total(agg1);
        RegionAggregate total2 = total(agg2);
        Map<Metric, MetricDelta> global = deltas(total1, total2);
        PlazaChurn churn = churn(total1.plazas(), total2.plazas(), period1.getPlazaKeys(), period2.getPlazaKeys());

        ComparisonResult result = ComparisonResult.builder()
                .key1(key1)
                .key2(key2)
                .label1(PeriodKey.label(key1))
                .label2(PeriodKey.label(key2))
                .appliedRegion(appliedRegion)
                .plazaAnalysis(churn)
                .globalMetrics(global)
                .byRegion(byRegion(agg1, agg2, names))
                .headline(HeadlineMetrics.from(churn, global.get(Metric.CERTIFICATION_TOTAL)))
                .createdAt(clock.instant())
                .cacheHit(false)
                .build();

        resultCache.put(cacheKey, result);
        log.info("Compared {} vs {} ({} regions, {})", result.getLabel1(), result.getLabel2(),
                result.getByRegion().size(), aggregation.name());
        return result;
    }

    // ── Year comparison ──────────────────────────────────────────────────────

    /**
     * Compare two years by summing every month of each that can be made
     * resident. A year with fewer than twelve summed months is flagged in the
     * notes, not rejected.
     *
     * @throws NoDataForYearException if a year has no candidate or no loadable month
     */
    public YearComparisonResult compareYears(int year1, int year2) {
        int y1 = PeriodKey.year(PeriodKey.encode(year1, 1));
        int y2 = PeriodKey.year(PeriodKey.encode(year2, 1));

        SortedSet<Integer> candidates1 = candidateMonths(y1);
        SortedSet<Integer> candidates2 = candidateMonths(y2);
        if (candidates1.isEmpty()) throw new NoDataForYearException(y1, "no months resident or indexed");
        if (candidates2.isEmpty()) throw new NoDataForYearException(y2, "no months resident or indexed");

        List<Period> periods1 = ensureMonths(y1, candidates1);
        List<Period> periods2 = ensureMonths(y2, candidates2);
        if (periods1.isEmpty()) throw new NoDataForYearException(y1, "none of " + candidates1 + " could be loaded");
        if (periods2.isEmpty()) throw new NoDataForYearException(y2, "none of " + candidates2 + " could be loaded");

        Map<Integer, RegionAggregate> agg1 = sumMonths(periods1);
        Map<Integer, RegionAggregate> agg2 = sumMonths(periods2);

        Map<Integer, String> names = new HashMap<>();
        periods2.forEach(p -> names.putAll(p.getRegionNames()));
        periods1.forEach(p -> names.putAll(p.getRegionNames()));

        List<Integer> months1 = months(periods1);
        List<Integer> months2 = months(periods2);

        RegionAggregate total1 = total(agg1);
        RegionAggregate total2 = total(agg2);

        List<String> notes = new ArrayList<>();
        YearSummary summary1 = summary(y1, months1, total1, notes);
        YearSummary summary2 = summary(y2, months2, total2, notes);

        log.info("Compared years {} ({} months) vs {} ({} months)", y1, months1.size(), y2, months2.size());
        return YearComparisonResult.builder()
                .year1(y1)
                .year2(y2)
                .summary1(summary1)
                .summary2(summary2)
                .globalMetrics(deltas(total1, total2))
                .byRegion(byRegion(agg1, agg2, names))
                .notes(notes)
                .build();
    }

    // ── Listing ──────────────────────────────────────────────────────────────

    /** Resident months plus everything the remote index could supply. */
    public PeriodListing periodsAvailable() {
        SortedMap<Integer, SortedSet<Integer>> byYear = store.residentMonthsByYear();
        for (String label : remoteIndex.labels()) {
            try {
                int key = PeriodKey.encode(label.substring(0, 4), label.substring(5));
                byYear.computeIfAbsent(PeriodKey.year(key), y -> new TreeSet<>()).add(PeriodKey.month(key));
            } catch (RuntimeException e) {
                log.debug("Ignoring unparseable index label '{}'", label);
            }
        }
        return PeriodListing.of(byYear, currentYear());
    }

    public int currentYear() {
        return Year.now(clock).getValue();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Ensure the period and take one snapshot of it. Everything after this
     * reads the snapshot, never the store.
     */
    private Period requireResident(int key) {
        EnsureResult ensured = fetcher.ensure(key);
        if (!ensured.ok()) {
            log.warn("Period {} unavailable: {}", PeriodKey.indexLabel(key), ensured.reason());
            throw new PeriodUnavailableException(key, ensured);
        }
        return store.get(key).orElseThrow(() -> {
            log.warn("Period {} was evicted before it could be read", PeriodKey.indexLabel(key));
            return new PeriodUnavailableException(key, new EnsureResult(false, EVICTED, null));
        });
    }

    private SortedSet<Integer> candidateMonths(int year) {
        SortedSet<Integer> months = new TreeSet<>(store.residentMonths(year));
        String prefix = year + "-";
        for (String label : remoteIndex.labels()) {
            if (!label.startsWith(prefix)) continue;
            try {
                months.add(PeriodKey.month(PeriodKey.encode(String.valueOf(year), label.substring(prefix.length()))));
            } catch (RuntimeException e) {
                log.debug("Ignoring unparseable index label '{}'", label);
            }
        }
        return months;
    }

    private List<Period> ensureMonths(int year, SortedSet<Integer> candidates) {
        List<Period> loaded = new ArrayList<>();
        for (int month : candidates) {
            int key = PeriodKey.encode(year, month);
            EnsureResult ensured = fetcher.ensure(key);
            Optional<Period> period = ensured.ok() ? store.get(key) : Optional.empty();
            if (period.isPresent()) {
                loaded.add(period.get());
            } else {
                log.warn("Year {}: month {} skipped: {}", year, month, ensured.ok() ? EVICTED : ensured.reason());
            }
        }
        return loaded;
    }

    private Map<Integer, RegionAggregate> sumMonths(List<Period> periods) {
        Map<Integer, RegionAggregate> sum = new TreeMap<>();
        for (Period period : periods) {
            aggregation.aggregate(period).forEach((region, agg) -> sum.merge(region, agg, RegionAggregate::plus));
        }
        return sum;
    }

    private static List<Integer> months(List<Period> periods) {
        List<Integer> months = new ArrayList<>(periods.size());
        for (Period period : periods) {
            months.add(PeriodKey.month(period.getKey()));
        }
        return months;
    }

    private static YearSummary summary(int year, List<Integer> months, RegionAggregate total, List<String> notes) {
        boolean complete = months.size() == 12;
        if (!complete) {
            notes.add(year + " incomplete: " + months.size() + " of 12 months");
        }
        Map<Metric, Long> metrics = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            metrics.put(metric, total.get(metric));
        }
        return new YearSummary(year, List.copyOf(months), total.plazas(), metrics, complete);
    }

    static String normaliseFilter(String regionFilter) {
        if (regionFilter == null) return "";
        String f = regionFilter.trim().toLowerCase(Locale.ROOT);
        return NO_FILTER.contains(f) ? "" : f;
    }

    private static Integer resolveRegion(String filter, Map<Integer, String> names) {
        return names.entrySet().stream()
                .filter(e -> e.getValue().trim().toLowerCase(Locale.ROOT).equals(filter))
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst()
                .orElse(null);
    }

    private static Map<Integer, RegionAggregate> onlyRegion(Map<Integer, RegionAggregate> agg, int regionId) {
        RegionAggregate only = agg.get(regionId);
        return only == null ? Map.of() : Map.of(regionId, only);
    }

    private static RegionAggregate total(Map<Integer, RegionAggregate> agg) {
        RegionAggregate total = RegionAggregate.empty(-1);
        for (RegionAggregate a : agg.values()) {
            total = total.plus(a);
        }
        return total;
    }

    static Map<Metric, MetricDelta> deltas(RegionAggregate a, RegionAggregate b) {
        Map<Metric, MetricDelta> out = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            out.put(metric, MetricDelta.between(a.get(metric), b.get(metric)));
        }
        return out;
    }

    static PlazaChurn churn(long count1, long count2, Set<String> keys1, Set<String> keys2) {
        if (!keys1.isEmpty() && !keys2.isEmpty()) {
            Set<String> added = new HashSet<>(keys2);
            added.removeAll(keys1);
            Set<String> removed = new HashSet<>(keys1);
            removed.removeAll(keys2);
            return new PlazaChurn(count1, count2, added.size(), removed.size(), count2, true);
        }
        return new PlazaChurn(count1, count2,
                Math.max(0, count2 - count1), Math.max(0, count1 - count2), count2, false);
    }

    private static Map<String, RegionComparison> byRegion(Map<Integer, RegionAggregate> agg1,
                                                          Map<Integer, RegionAggregate> agg2,
                                                          Map<Integer, String> names) {
        Set<Integer> regions = new TreeSet<>(agg1.keySet());
        regions.addAll(agg2.keySet());

        Map<String, RegionComparison> out = new TreeMap<>();
        for (int region : regions) {
            RegionAggregate a = agg1.getOrDefault(region, RegionAggregate.empty(region));
            RegionAggregate b = agg2.getOrDefault(region, RegionAggregate.empty(region));
            String name = names.getOrDefault(region, "Estado_" + region);
            out.put(name, new RegionComparison(region, name, a.plazas(), b.plazas(), deltas(a, b)));
        }
        return out;
    }
}
