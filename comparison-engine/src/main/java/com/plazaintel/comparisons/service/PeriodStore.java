package com.plazaintel.comparisons.service;

import com.plazaintel.comparisons.backend.AccelerationGateway;
import com.plazaintel.comparisons.model.InvalidPeriodException;
import com.plazaintel.comparisons.model.Period;
import com.plazaintel.comparisons.model.PeriodKey;
import com.plazaintel.comparisons.model.PeriodListing;
import com.plazaintel.comparisons.model.PlazaRecord;
import com.plazaintel.comparisons.model.TabularDataset;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Owns every resident period, its last-access time and the protected set.
 *
 * Protected periods come from the local dataset and are never evicted.
 * Historical periods come from the remote index and are subject to LRU eviction.
 *
 * One lock guards all three maps. It is never held across network I/O or
 * calls into the acceleration backend: periods are built outside the lock and
 * swapped in.
 */
@Slf4j
public class PeriodStore {

    static final String[] YEAR_COLUMNS = {"Año", "anio", "ANIO", "año"};
    static final String[] MONTH_COLUMNS = {"Cve-mes", "cve_mes", "Mes", "mes"};
    static final String[] NUMERIC_MONTH_COLUMNS = {"Cve-mes", "cve_mes"};

    private final PlazaRecordMapper mapper;
    private final AccelerationGateway backend;
    private final LongSupplier ticker;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, Period> periods = new HashMap<>();
    private final Map<Integer, Long> lastAccess = new HashMap<>();
    private final Set<Integer> protectedKeys = new HashSet<>();

    public PeriodStore(PlazaRecordMapper mapper, AccelerationGateway backend) {
        this(mapper, backend, System::nanoTime);
    }

    public PeriodStore(PlazaRecordMapper mapper, AccelerationGateway backend, LongSupplier ticker) {
        this.mapper = mapper;
        this.backend = backend;
        this.ticker = ticker;
    }

    public record Snapshot(int resident, int protectedCount, int historical, long rows) {}

    // ── Indexing ─────────────────────────────────────────────────────────────

    /**
     * Partition the local dataset by (year, month) and make every partition a
     * protected period. Rows with a malformed year or month are counted,
     * logged and skipped.
     *
     * @return number of periods indexed
     */
    public int indexProtected(TabularDataset dataset) {
        if (dataset == null || dataset.isEmpty()) {
            log.warn("indexProtected: empty dataset, nothing indexed");
            return 0;
        }
        log.info("indexProtected: columns available = {}", dataset.columns());

        String yearColumn = dataset.findColumn(YEAR_COLUMNS).orElse(null);
        String monthColumn = dataset.findColumn(MONTH_COLUMNS).orElse(null);
        if (yearColumn == null || monthColumn == null) {
            log.warn("indexProtected: year/month columns not found (year={}, month={}), nothing indexed",
                    yearColumn, monthColumn);
            return 0;
        }

        // "Mes" may hold month names ("Enero"); the numeric one is Cve-mes
        if (!looksNumeric(dataset, monthColumn)) {
            String alt = dataset.findColumn(NUMERIC_MONTH_COLUMNS).orElse(null);
            if (alt == null || alt.equals(monthColumn)) {
                log.warn("indexProtected: '{}' is not numeric and there is no Cve-mes column, nothing indexed",
                        monthColumn);
                return 0;
            }
            log.info("indexProtected: using '{}' as numeric month column", alt);
            monthColumn = alt;
        }

        // rows are grouped by the encoded key so "1", "01" and "1.0" land together
        Map<Integer, List<Map<String, String>>> groups = new TreeMap<>();
        int malformed = 0;
        for (Map<String, String> row : dataset.rows()) {
            String year = row.get(yearColumn);
            String month = row.get(monthColumn);
            if (year == null || year.isBlank() || month == null || month.isBlank()) continue;
            try {
                groups.computeIfAbsent(PeriodKey.encode(year, month), k -> new ArrayList<>()).add(row);
            } catch (InvalidPeriodException e) {
                malformed++;
            }
        }
        if (malformed > 0) {
            log.warn("indexProtected: skipped {} rows with a malformed year/month", malformed);
        }

        List<String> indexed = new ArrayList<>();
        for (Map.Entry<Integer, List<Map<String, String>>> group : groups.entrySet()) {
            int key = group.getKey();
            List<PlazaRecord> records = mapper.map(dataset.withRows(group.getValue()));
            Period period = new Period(key, records, true);

            lock.lock();
            try {
                periods.put(key, period);
                lastAccess.put(key, ticker.getAsLong());
                protectedKeys.add(key);
            } finally {
                lock.unlock();
            }

            backend.mirror(key, records);
            indexed.add(PeriodKey.indexLabel(key));
        }

        indexed.sort(Comparator.naturalOrder());
        log.info("Local dataset indexed and protected: {} periods → {}", indexed.size(), indexed);
        return indexed.size();
    }

    // ── Reads ────────────────────────────────────────────────────────────────

    /** Returns the period and refreshes its access time. */
    public Optional<Period> get(int key) {
        lock.lock();
        try {
            Period period = periods.get(key);
            if (period != null) {
                lastAccess.put(key, ticker.getAsLong());
            }
            return Optional.ofNullable(period);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(int key) {
        lock.lock();
        try {
            return periods.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean isProtected(int key) {
        lock.lock();
        try {
            return protectedKeys.contains(key);
        } finally {
            lock.unlock();
        }
    }

    public Set<Integer> protectedKeys() {
        lock.lock();
        try {
            return Set.copyOf(protectedKeys);
        } finally {
            lock.unlock();
        }
    }

    public Set<Integer> residentKeys() {
        lock.lock();
        try {
            return Set.copyOf(periods.keySet());
        } finally {
            lock.unlock();
        }
    }

    /** Unfiltered: year → resident months. */
    public SortedMap<Integer, SortedSet<Integer>> residentMonthsByYear() {
        SortedMap<Integer, SortedSet<Integer>> byYear = new TreeMap<>();
        for (int key : residentKeys()) {
            byYear.computeIfAbsent(PeriodKey.year(key), y -> new TreeSet<>()).add(PeriodKey.month(key));
        }
        return byYear;
    }

    public SortedSet<Integer> residentMonths(int year) {
        return residentMonthsByYear().getOrDefault(year, new TreeSet<>());
    }

    /**
     * Listing view: the current year with any resident months, other years
     * only when all twelve months are resident.
     */
    public PeriodListing availablePeriods(int currentYear) {
        return PeriodListing.of(residentMonthsByYear(), currentYear);
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            long rows = periods.values().stream().mapToLong(Period::size).sum();
            return new Snapshot(periods.size(), protectedKeys.size(), periods.size() - protectedKeys.size(), rows);
        } finally {
            lock.unlock();
        }
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    /**
     * Insert or replace a downloaded period. Protection is left as it was:
     * replacing a protected key keeps it protected.
     */
    public Period putHistorical(int key, List<PlazaRecord> records) {
        Period fresh = new Period(key, records, false);

        lock.lock();
        try {
            Period installed = protectedKeys.contains(key) ? fresh.asProtected() : fresh;
            periods.put(key, installed);
            lastAccess.put(key, ticker.getAsLong());
            return installed;
        } finally {
            lock.unlock();
        }
    }

    // ── Eviction ─────────────────────────────────────────────────────────────

    /**
     * Remove the least recently used historical periods until at most
     * {@code maxHistorical} remain. Protected keys are excluded from the
     * ranking, so they can never be chosen.
     *
     * @return number of periods evicted
     */
    public int evictLru(int maxHistorical) {
        List<Integer> evicted = new ArrayList<>();

        lock.lock();
        try {
            List<Map.Entry<Integer, Long>> ranked = new ArrayList<>();
            for (Map.Entry<Integer, Long> e : lastAccess.entrySet()) {
                if (!protectedKeys.contains(e.getKey()) && periods.containsKey(e.getKey())) {
                    ranked.add(Map.entry(e.getKey(), e.getValue()));
                }
            }
            ranked.sort(Map.Entry.<Integer, Long>comparingByValue().thenComparing(Map.Entry.<Integer, Long>comparingByKey()));

            int toEvict = Math.max(0, ranked.size() - Math.max(0, maxHistorical));
            for (int i = 0; i < toEvict; i++) {
                int key = ranked.get(i).getKey();
                periods.remove(key);
                lastAccess.remove(key);
                evicted.add(key);
            }
        } finally {
            lock.unlock();
        }

        if (!evicted.isEmpty()) {
            log.info("Evicted {} historical periods {} (protected intact: {})",
                    evicted.size(), evicted, protectedKeys().size());
        }
        return evicted.size();
    }

    /**
     * Drop historical periods the backend no longer holds, so the two stores
     * do not drift apart. No-op without a backend.
     *
     * @return number of periods removed
     */
    public int syncWithBackend() {
        if (!backend.isPresent()) return 0;

        List<Integer> candidates = new ArrayList<>();
        lock.lock();
        try {
            for (Integer key : periods.keySet()) {
                if (!protectedKeys.contains(key)) candidates.add(key);
            }
        } finally {
            lock.unlock();
        }

        int removed = 0;
        for (int key : candidates) {
            if (!backend.reportsMissing(key)) continue;
            lock.lock();
            try {
                if (!protectedKeys.contains(key) && periods.remove(key) != null) {
                    lastAccess.remove(key);
                    removed++;
                }
            } finally {
                lock.unlock();
            }
        }

        if (removed > 0) {
            log.info("Backend sync: dropped {} historical periods no longer cached in backend", removed);
        }
        return removed;
    }

    /** Drop every historical period. */
    public int clearHistorical() {
        return evictLru(0);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static boolean looksNumeric(TabularDataset dataset, String column) {
        int sampled = 0;
        for (Map<String, String> row : dataset.rows()) {
            String val = row.get(column);
            if (val == null || val.isBlank()) continue;
            try {
                new BigDecimal(val.trim());
                return true;
            } catch (NumberFormatException e) {
                if (++sampled >= 10) return false;
            }
        }
        return false;
    }
}
