package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optimizer statistics for a table. {@link #empty()} stands for "no statistics row",
 * which is a normal outcome and serializes as an empty object.
 *
 * @param blocks block count (Oracle), data length in bytes (MySQL), total relation size (PostgreSQL)
 *               or total space in KB (SQL Server)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Statistics(
        @JsonProperty("num_rows") Long numRows,
        @JsonProperty("blocks") Long blocks,
        @JsonProperty("avg_row_len") Long avgRowLen,
        @JsonProperty("last_analyzed") String lastAnalyzed
) {
    private static final Statistics EMPTY = new Statistics(null, null, null, null);

    public static Statistics empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return numRows == null && blocks == null && avgRowLen == null && lastAnalyzed == null;
    }
}
