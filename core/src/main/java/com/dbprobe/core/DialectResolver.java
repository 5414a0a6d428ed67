package com.dbprobe.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a connection alias to its {@link DialectKind} from the {@code <ALIAS>_TYPE} marker.
 * <p>
 * The legacy {@code DWH} alias predates the marker and falls back to Oracle when it is unset.
 */
public class DialectResolver {
    public static final String LEGACY_ALIAS = "DWH";
    public static final String TYPE_SUFFIX = "_TYPE";

    private final Function<String, String> lookup;

    /**
     * @param lookup configuration source, typically {@code System::getenv}; returns null for unset keys
     */
    public DialectResolver(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    public DialectKind resolve(String alias) {
        String marker = markerFor(alias);
        String value = lookup.apply(marker);

        if (value == null || value.isBlank()) {
            if (LEGACY_ALIAS.equalsIgnoreCase(alias.trim())) {
                return DialectKind.ORACLE;
            }
            throw new ConfigurationException(marker + " is not set; expected one of " + supported());
        }

        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DialectKind kind : DialectKind.values()) {
            if (kind.label().equals(normalized)) {
                return kind;
            }
        }
        throw new ConfigurationException(
                "Database type '" + normalized + "' (" + marker + ") is not supported; expected one of " + supported());
    }

    public static String markerFor(String alias) {
        return alias.trim().toUpperCase(Locale.ROOT) + TYPE_SUFFIX;
    }

    private static String supported() {
        return Arrays.stream(DialectKind.values())
                .map(DialectKind::label)
                .collect(Collectors.joining(", "));
    }
}
