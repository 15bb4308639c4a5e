package com.schema.migration.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One result row: an immutable mapping of column names to tagged {@link Value}s.
 */
public final class QueryRow {

    private final Map<String, Value> columns;

    private QueryRow(Map<String, Value> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    /**
     * Decodes a raw driver row.
     */
    public static QueryRow of(Map<String, ?> raw) {
        Map<String, Value> columns = new LinkedHashMap<>();
        raw.forEach((key, value) -> columns.put(key, Value.of(value)));
        return new QueryRow(columns);
    }

    /**
     * Returns the value of a column, or {@link Value#none()} if absent.
     */
    public Value get(String column) {
        return columns.getOrDefault(column, Value.none());
    }

    public boolean has(String column) {
        return !get(column).isNone();
    }

    public Set<String> columns() {
        return columns.keySet();
    }

    public Map<String, Value> asMap() {
        return columns;
    }

    @Override
    public String toString() {
        return columns.toString();
    }
}
