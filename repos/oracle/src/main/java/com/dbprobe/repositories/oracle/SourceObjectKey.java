package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.ObjectType;

import java.util.Comparator;

/**
 * Identifies one stored program in ALL_SOURCE.
 */
public record SourceObjectKey(String owner, String name, ObjectType type) {

    /**
     * Owner, then name, then the catalog spelling of the type.
     */
    public static final Comparator<SourceObjectKey> CATALOG_ORDER = Comparator
            .comparing(SourceObjectKey::owner)
            .thenComparing(SourceObjectKey::name)
            .thenComparing(key -> key.type().catalogName());
}
