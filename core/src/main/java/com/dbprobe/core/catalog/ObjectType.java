package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Stored-program object types whose source is searchable.
 */
public enum ObjectType {
    PROCEDURE("PROCEDURE"),
    PACKAGE("PACKAGE"),
    PACKAGE_BODY("PACKAGE BODY"),
    FUNCTION("FUNCTION");

    private final String catalogName;

    ObjectType(String catalogName) {
        this.catalogName = catalogName;
    }

    /**
     * The spelling used by the {@code TYPE} column of {@code ALL_SOURCE}.
     */
    @JsonValue
    public String catalogName() {
        return catalogName;
    }

    public static Optional<ObjectType> fromCatalogName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        for (ObjectType type : values()) {
            if (type.catalogName.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return catalogName;
    }
}
