package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One index of a table.
 *
 * @param unique  the engine's own uniqueness label, e.g. {@code UNIQUE} or {@code NONUNIQUE}
 * @param columns key columns in key-position order, joined with {@code ", "}
 */
public record Index(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("unique") String unique,
        @JsonProperty("columns") String columns
) {}
