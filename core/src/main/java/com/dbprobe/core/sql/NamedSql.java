package com.dbprobe.core.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * SQL text written with {@code :name} bind markers.
 * <p>
 * Markers inside quotes and comments are ignored, as are PostgreSQL {@code ::type} casts.
 * The same statement can be rendered for JDBC ({@code ?}), in a dialect's native
 * {@link ParamStyle}, or with the bound values inlined as literals for copy-paste debugging.
 */
public final class NamedSql {
    private final String sql;
    private final List<Marker> markers;

    private record Marker(int start, int end, String name) {}

    private NamedSql(String sql, List<Marker> markers) {
        this.sql = sql;
        this.markers = markers;
    }

    public static NamedSql parse(String sql) {
        List<Marker> markers = new ArrayList<>();
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = SqlText.skipQuoted(sql, i);
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
            } else if (c == ':' && i + 1 < n && sql.charAt(i + 1) == ':') {
                i += 2;
            } else if (c == ':' && i + 1 < n && isNameStart(sql.charAt(i + 1))) {
                int end = i + 1;
                while (end < n && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '_')) {
                    end++;
                }
                markers.add(new Marker(i, end, sql.substring(i + 1, end)));
                i = end;
            } else {
                i++;
            }
        }
        return new NamedSql(sql, Collections.unmodifiableList(markers));
    }

    /**
     * Bind names in order of appearance; a name used twice appears twice.
     */
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>(markers.size());
        for (Marker marker : markers) {
            names.add(marker.name());
        }
        return names;
    }

    public String jdbcSql() {
        return render(ParamStyle.QMARK);
    }

    public String render(ParamStyle style) {
        return substitute(marker -> style.render(marker.name()));
    }

    /**
     * Inlines bound values: strings become single-quoted literals with quotes doubled,
     * null becomes {@code NULL}, anything else its string form.
     */
    public String executable(Map<String, ?> values) {
        return substitute(marker -> {
            if (!values.containsKey(marker.name())) {
                throw new IllegalArgumentException("No value bound for :" + marker.name());
            }
            return toLiteral(values.get(marker.name()));
        });
    }

    public String text() {
        return sql;
    }

    public static String toLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof CharSequence) {
            return "'" + value.toString().replace("'", "''") + "'";
        }
        return value.toString();
    }

    private String substitute(Function<Marker, String> replacement) {
        StringBuilder out = new StringBuilder(sql.length());
        int last = 0;
        for (Marker marker : markers) {
            out.append(sql, last, marker.start()).append(replacement.apply(marker));
            last = marker.end();
        }
        out.append(sql, last, sql.length());
        return out.toString();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    @Override
    public String toString() {
        return sql;
    }
}
