package com.dbprobe.core.catalog;

/**
 * One raw catalog row describing a single key column of an index.
 */
public record IndexColumn(
        String indexName,
        String indexType,
        String uniqueness,
        String columnName,
        int position
) {}
