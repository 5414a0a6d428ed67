package com.dbprobe.core.sql;

import com.dbprobe.core.DialectKind;

/**
 * Bind-parameter spellings of the supported engines' native client libraries.
 * JDBC always binds positionally; these styles are used when a statement is shown
 * to an operator in the form they would paste into the engine's own tooling.
 */
public enum ParamStyle {
    NAMED(":param"),
    FORMAT("%s"),
    QMARK("?");

    private final String placeholder;

    ParamStyle(String placeholder) {
        this.placeholder = placeholder;
    }

    public static ParamStyle of(DialectKind dialect) {
        return switch (dialect) {
            case ORACLE -> NAMED;
            case MYSQL, POSTGRESQL -> FORMAT;
            case SQLSERVER -> QMARK;
        };
    }

    public static String placeholder(DialectKind dialect) {
        return of(dialect).placeholder;
    }

    public String placeholder() {
        return placeholder;
    }

    public String render(String name) {
        return this == NAMED ? ":" + name : placeholder;
    }
}
