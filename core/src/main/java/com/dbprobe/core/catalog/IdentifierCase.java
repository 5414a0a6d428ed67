package com.dbprobe.core.catalog;

import java.util.Locale;

/**
 * How an engine folds unquoted identifiers. Names are compared in the folded form.
 */
public enum IdentifierCase {
    UPPER {
        @Override
        public String fold(String identifier) {
            return identifier.toUpperCase(Locale.ROOT);
        }
    },
    LOWER {
        @Override
        public String fold(String identifier) {
            return identifier.toLowerCase(Locale.ROOT);
        }
    };

    public abstract String fold(String identifier);
}
