package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Column(
        @JsonProperty("name") String name,
        @JsonProperty("data_type") String dataType,
        @JsonProperty("nullable") boolean nullable,
        @JsonProperty("default") String defaultValue,
        @JsonProperty("comment") String comment
) {
    public Column {
        comment = comment == null ? "" : comment;
    }
}
