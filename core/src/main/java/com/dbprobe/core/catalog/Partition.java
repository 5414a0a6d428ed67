package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param compression compression setting (Oracle), partition method (MySQL) or partition scheme (SQL Server)
 */
public record Partition(
        @JsonProperty("name") String name,
        @JsonProperty("position") int position,
        @JsonProperty("high_value") String highValue,
        @JsonProperty("num_rows") Long numRows,
        @JsonProperty("compression") String compression
) {}
