package com.dbprobe.core.sql;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether free-form SQL is safe to run against a production catalog.
 * <p>
 * A statement is read-only when, with comments removed, it starts with SELECT, WITH or
 * EXPLAIN, contains no data-changing or privileged keyword anywhere, and is a single
 * statement (one trailing semicolon is tolerated).
 * <p>
 * The text is read twice, once with doubled-quote escapes and once with backslash escapes,
 * and must pass under both readings. The two readings must also agree on where the comments are.
 */
public final class QuerySafetyGuard {
    public static final List<String> ALLOWED_PREFIXES = List.of("SELECT", "WITH", "EXPLAIN");

    public static final List<String> BLOCKED_KEYWORDS = List.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "ALTER", "CREATE", "TRUNCATE",
            "MERGE", "GRANT", "REVOKE", "EXEC", "EXECUTE");

    private static final Pattern ALLOWED_START = Pattern.compile(
            "^\\s*(" + String.join("|", ALLOWED_PREFIXES) + ")\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern BLOCKED = Pattern.compile(
            "\\b(" + String.join("|", BLOCKED_KEYWORDS) + ")\\b", Pattern.CASE_INSENSITIVE);

    private QuerySafetyGuard() {}

    public static boolean isReadOnly(String sql) {
        if (sql == null || sql.isBlank()) {
            return false;
        }
        String standard = SqlText.stripTerminators(SqlText.stripComments(sql, false));
        String backslashed = SqlText.stripTerminators(SqlText.stripComments(sql, true));
        return standard.equals(backslashed)
                && passes(standard, false)
                && passes(backslashed, true);
    }

    private static boolean passes(String statement, boolean backslashEscapes) {
        if (!ALLOWED_START.matcher(statement).find()) {
            return false;
        }
        if (BLOCKED.matcher(statement).find()) {
            return false;
        }
        return !SqlText.containsUnquoted(statement, ';', backslashEscapes);
    }

    /**
     * The statement as it should be sent to the server: comments removed, terminators stripped.
     */
    public static String normalize(String sql) {
        return SqlText.stripTerminators(SqlText.stripComments(sql));
    }

    public static String leadingKeyword(String sql) {
        String statement = normalize(sql);
        int end = 0;
        while (end < statement.length() && Character.isLetter(statement.charAt(end))) {
            end++;
        }
        return statement.substring(0, end).toUpperCase(Locale.ROOT);
    }
}
