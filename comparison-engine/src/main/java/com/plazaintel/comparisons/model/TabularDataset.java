package com.plazaintel.comparisons.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw parsed table: column names plus string cells, before any typing.
 * Column lookup tolerates the naming drift seen across monthly exports
 * ("Cve-mes" vs "cve_mes"), so callers pass a list of candidates.
 */
public final class TabularDataset {

    private final List<String> columns;
    private final List<Map<String, String>> rows;

    public TabularDataset(List<String> columns, List<Map<String, String>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static TabularDataset empty() {
        return new TabularDataset(List.of(), List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, String>> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * First candidate present in the table: exact match wins, then a
     * case-insensitive one.
     */
    public Optional<String> findColumn(String... candidates) {
        for (String candidate : candidates) {
            if (columns.contains(candidate)) {
                return Optional.of(candidate);
            }
            for (String column : columns) {
                if (column.equalsIgnoreCase(candidate)) {
                    return Optional.of(column);
                }
            }
        }
        return Optional.empty();
    }

    public TabularDataset withRows(List<Map<String, String>> subset) {
        return new TabularDataset(columns, subset);
    }
}
