package com.dbprobe.core.catalog;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A metadata search request.
 *
 * @param schema optional schema/owner filter, null for all schemas
 * @param regex  treat {@code keyword} as a case-insensitive regular expression instead of a substring
 * @param limit  maximum number of matching columns to return
 */
public record MetadataQuery(
        String keyword,
        String schema,
        Set<SearchField> fields,
        boolean regex,
        int limit
) {
    public static final int DEFAULT_LIMIT = 200;

    public MetadataQuery {
        if (keyword == null || keyword.isEmpty()) {
            throw new IllegalArgumentException("keyword must not be empty");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, was " + limit);
        }
        schema = schema == null || schema.isBlank() ? null : schema.trim();
        fields = fields == null || fields.isEmpty()
                ? EnumSet.allOf(SearchField.class)
                : Collections.unmodifiableSet(EnumSet.copyOf(fields));
    }

    public boolean searchesNames() {
        return fields.contains(SearchField.NAMES);
    }

    public boolean searchesComments() {
        return fields.contains(SearchField.COMMENTS);
    }
}
