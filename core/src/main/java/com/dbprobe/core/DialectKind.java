package com.dbprobe.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The database engines dbprobe knows how to introspect.
 * Dispatch over this enum is done with exhaustive switches, so a new engine
 * fails compilation everywhere it still needs an implementation.
 */
public enum DialectKind {
    ORACLE("oracle"),
    MYSQL("mysql"),
    POSTGRESQL("postgresql"),
    SQLSERVER("sqlserver");

    private final String label;

    DialectKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
