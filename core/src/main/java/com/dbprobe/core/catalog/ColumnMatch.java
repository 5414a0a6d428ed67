package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ColumnMatch(
        @JsonProperty("schema") String schema,
        @JsonProperty("table") String table,
        @JsonProperty("table_comment") String tableComment,
        @JsonProperty("column") String column,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("column_comment") String columnComment
) {
    public ColumnMatch {
        tableComment = tableComment == null ? "" : tableComment;
        columnComment = columnComment == null ? "" : columnComment;
    }
}
