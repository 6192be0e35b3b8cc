package io.querymesh.source;

import java.util.Map;

/**
 * One input row: the query text plus every column as text, for filtering.
 */
public record QueryRow(String query, Map<String, String> columns) {
    public QueryRow {
        columns = columns == null ? Map.of() : columns;
    }

    public boolean matches(Map<String, String> filters) {
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            String actual = columns.get(filter.getKey());
            if (actual == null || !actual.equals(filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    public boolean hasQuery() {
        return query != null && !query.isBlank();
    }
}
