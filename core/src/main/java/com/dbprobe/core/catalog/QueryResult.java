package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by a guarded query. Cell values are already converted to
 * strings, numbers, booleans or null.
 *
 * @param truncated true when the row cap was reached and more rows may exist
 */
public record QueryResult(
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("rows") List<List<Object>> rows,
        @JsonProperty("row_count") int rowCount,
        @JsonProperty("execution_time_ms") double executionTimeMs,
        @JsonProperty("truncated") boolean truncated,
        @JsonProperty("row_limit") int rowLimit
) {
    public QueryResult {
        columns = List.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }
}
