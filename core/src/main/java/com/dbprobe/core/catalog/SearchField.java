package com.dbprobe.core.catalog;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum SearchField {
    NAMES,
    COMMENTS;

    /**
     * Parses a comma separated list such as {@code "comments,names"}. Blank input selects both fields.
     */
    public static Set<SearchField> parse(String csv) {
        if (csv == null || csv.isBlank()) {
            return EnumSet.allOf(SearchField.class);
        }
        EnumSet<SearchField> fields = EnumSet.noneOf(SearchField.class);
        for (String part : csv.split(",")) {
            String token = part.trim();
            if (token.isEmpty()) {
                continue;
            }
            try {
                fields.add(SearchField.valueOf(token.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown search field '" + token + "'; expected names or comments", e);
            }
        }
        return fields.isEmpty() ? EnumSet.allOf(SearchField.class) : fields;
    }
}
