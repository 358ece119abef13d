package com.seqmine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tabular input as read from a record source.
 * 
 * Rows are keyed by the raw column names. The position of a row in {@link #rows()}
 * identifies it in error messages.
 * 
 * Invariants:
 * - columns are distinct
 * - every row key is one of the columns
 */
public record RawTable(
    List<String> columns,
    List<Map<String, Object>> rows
) {
    public RawTable {
        columns = List.copyOf(columns);
        List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            // values may be null, so Map.copyOf is not an option
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copies);
    }

    public static RawTable of(List<String> columns, List<Map<String, Object>> rows) {
        return new RawTable(columns, rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Value of a raw column in the given row, or null.
     */
    public Object value(int position, String column) {
        return rows.get(position).get(column);
    }
}
