package com.jay.valuation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One financial statement as delivered by a provider: period rows, most recent first,
 * sharing one column schema. Cell values are numbers, strings or null.
 */
public final class TabularRecord {

    private static final TabularRecord EMPTY = new TabularRecord(List.of(), List.of());

    private final List<ColumnLabel> columns;
    private final List<Map<ColumnLabel, Object>> rows;

    private TabularRecord(List<ColumnLabel> columns, List<Map<ColumnLabel, Object>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public static TabularRecord empty() {
        return EMPTY;
    }

    /**
     * Builds a record from rows keyed by wire labels ("Label" or "Category|Label").
     * The column schema is the union of keys in first-seen order.
     */
    public static TabularRecord ofRows(List<? extends Map<String, ?>> rawRows) {
        if (rawRows == null || rawRows.isEmpty()) return EMPTY;
        Set<ColumnLabel> schema = new LinkedHashSet<>();
        List<Map<ColumnLabel, Object>> rows = new ArrayList<>(rawRows.size());
        for (Map<String, ?> raw : rawRows) {
            Map<ColumnLabel, Object> row = new LinkedHashMap<>();
            if (raw != null) {
                raw.forEach((key, value) -> {
                    ColumnLabel label = ColumnLabel.parse(key);
                    schema.add(label);
                    row.put(label, value);
                });
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new TabularRecord(List.copyOf(schema), Collections.unmodifiableList(rows));
    }

    public List<ColumnLabel> columns() {
        return columns;
    }

    public int periodCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Cell at {@code period} (0 = most recent); null when the row lacks the column. */
    public Object value(int period, ColumnLabel column) {
        if (period < 0 || period >= rows.size()) return null;
        return rows.get(period).get(column);
    }

    @Override
    public String toString() {
        return "TabularRecord[periods=" + rows.size() + ", columns=" + columns.size() + "]";
    }
}
