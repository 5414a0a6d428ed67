package com.dbprobe.core.catalog;

import com.dbprobe.core.DialectKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TableInfo(
        @JsonProperty("schema") String schema,
        @JsonProperty("table") String table,
        @JsonProperty("db_type") DialectKind dialect,
        @JsonProperty("table_comment") String tableComment,
        @JsonProperty("columns") List<Column> columns,
        @JsonProperty("indexes") List<Index> indexes,
        @JsonProperty("partitions") List<Partition> partitions,
        @JsonProperty("statistics") Statistics statistics
) {
    public TableInfo {
        tableComment = tableComment == null ? "" : tableComment;
        columns = List.copyOf(columns);
        indexes = List.copyOf(indexes);
        partitions = List.copyOf(partitions);
        statistics = statistics == null ? Statistics.empty() : statistics;
    }
}
