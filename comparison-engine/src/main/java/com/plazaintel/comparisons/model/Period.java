package com.plazaintel.comparisons.model;

import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One resident (year, month) dataset. Immutable: the store swaps whole
 * instances in and out, it never edits one.
 */
@Getter
public final class Period {

    private final int key;
    private final List<PlazaRecord> records;
    private final Map<Integer, String> regionNames;
    private final Set<String> plazaKeys;
    private final boolean protectedPeriod;

    public Period(int key, List<PlazaRecord> records, boolean protectedPeriod) {
        this.key = key;
        this.records = List.copyOf(records);
        this.regionNames = Collections.unmodifiableMap(buildRegionNames(this.records));
        this.plazaKeys = Collections.unmodifiableSet(collectPlazaKeys(this.records));
        this.protectedPeriod = protectedPeriod;
    }

    public Period asProtected() {
        return protectedPeriod ? this : new Period(key, records, true);
    }

    public int size() {
        return records.size();
    }

    private static Map<Integer, String> buildRegionNames(List<PlazaRecord> records) {
        Map<Integer, String> names = new HashMap<>();
        for (PlazaRecord r : records) {
            if (r.getRegionId() == null || r.getRegionName() == null) continue;
            String name = r.getRegionName().trim();
            if (name.isEmpty() || name.equalsIgnoreCase("nan") || name.equalsIgnoreCase("none")) continue;
            names.put(r.getRegionId(), name);
        }
        return names;
    }

    private static Set<String> collectPlazaKeys(List<PlazaRecord> records) {
        Set<String> keys = new HashSet<>();
        for (PlazaRecord r : records) {
            if (r.getPlazaKey() != null && !r.getPlazaKey().isBlank()) {
                keys.add(r.getPlazaKey());
            }
        }
        return keys;
    }
}
