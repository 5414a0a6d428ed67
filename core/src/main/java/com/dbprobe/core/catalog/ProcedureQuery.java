package com.dbprobe.core.catalog;

import java.util.EnumSet;
import java.util.List;

/**
 * A stored-program source search.
 *
 * @param tableName   table name to look for in source lines, or null
 * @param text        free text to look for in source lines, or null
 * @param schema      owner filter, or null for every owner
 * @param objectTypes object types to search; empty means all of them
 * @param objectLimit maximum number of objects returned
 * @param lineLimit   maximum source lines returned per object, 0 for no limit
 */
public record ProcedureQuery(
        String tableName,
        String text,
        String schema,
        List<ObjectType> objectTypes,
        boolean regex,
        int objectLimit,
        int lineLimit
) {
    public static final int DEFAULT_OBJECT_LIMIT = 100;

    public ProcedureQuery {
        tableName = blankToNull(tableName);
        text = blankToNull(text);
        schema = blankToNull(schema);
        objectTypes = objectTypes == null || objectTypes.isEmpty()
                ? List.copyOf(EnumSet.allOf(ObjectType.class))
                : List.copyOf(EnumSet.copyOf(objectTypes));
        if (objectLimit <= 0) {
            throw new IllegalArgumentException("objectLimit must be positive, was " + objectLimit);
        }
        if (lineLimit < 0) {
            throw new IllegalArgumentException("lineLimit must not be negative, was " + lineLimit);
        }
    }

    public boolean hasFilter() {
        return tableName != null || text != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
