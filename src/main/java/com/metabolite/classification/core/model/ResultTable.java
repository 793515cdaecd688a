package com.metabolite.classification.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered result of a pipeline run, keyed by metabolite name.
 *
 * <p>Rows keep the position of the first occurrence of a name; a later record for
 * the same name replaces the earlier one in place.</p>
 */
public class ResultTable {

    private final Map<String, MergedRecord> rows = new LinkedHashMap<>();

    public void put(MergedRecord record) {
        rows.put(record.metaboliteName(), record);
    }

    public Optional<MergedRecord> get(String metaboliteName) {
        return Optional.ofNullable(rows.get(metaboliteName));
    }

    public Collection<MergedRecord> records() {
        return Collections.unmodifiableCollection(rows.values());
    }

    public List<String> names() {
        return new ArrayList<>(rows.keySet());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Every column populated by at least one row, in order of first appearance.
     */
    public List<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        for (MergedRecord record : rows.values()) {
            columns.addAll(record.toColumns().keySet());
        }
        return new ArrayList<>(columns);
    }

    /**
     * The summary columns that at least one row populates.
     */
    public List<String> displayColumns() {
        List<String> present = columns();
        List<String> display = new ArrayList<>();
        for (String column : ResultColumns.DISPLAY) {
            if (present.contains(column)) {
                display.add(column);
            }
        }
        return display;
    }

    @Override
    public String toString() {
        return "ResultTable{rows=" + rows.size() + ", columns=" + columns() + '}';
    }
}
