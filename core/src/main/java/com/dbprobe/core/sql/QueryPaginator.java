package com.dbprobe.core.sql;

import com.dbprobe.core.DialectKind;

/**
 * Rewrites an already validated read-only statement so that it returns at most N rows,
 * using each engine's own idiom. This is text rewriting, not parsing.
 */
public final class QueryPaginator {
    public static final String SUBQUERY_ALIAS = "_limited";

    private QueryPaginator() {}

    public static String cap(String sql, int maxRows, DialectKind dialect) {
        String body = prepare(sql, maxRows);
        return switch (dialect) {
            case ORACLE -> wrapRownum(body, maxRows);
            case MYSQL, POSTGRESQL -> body + " LIMIT " + maxRows;
            case SQLSERVER -> injectTop(body, maxRows);
        };
    }

    /**
     * Variant of {@link #cap} for statements that will be nested in a further query: the
     * MySQL/PostgreSQL form becomes an aliased derived table so it can be selected from.
     */
    public static String capAsSubquery(String sql, int maxRows, DialectKind dialect) {
        String body = prepare(sql, maxRows);
        return switch (dialect) {
            case ORACLE -> wrapRownum(body, maxRows);
            case MYSQL, POSTGRESQL -> "SELECT * FROM (" + body + ") " + SUBQUERY_ALIAS + " LIMIT " + maxRows;
            case SQLSERVER -> injectTop(body, maxRows);
        };
    }

    /**
     * True when the main statement already carries its own LIMIT, OFFSET or FETCH clause,
     * so a further LIMIT cannot simply be appended.
     */
    public static boolean hasOwnRowLimit(String sql) {
        String body = QuerySafetyGuard.normalize(sql);
        for (String keyword : new String[]{"LIMIT", "OFFSET", "FETCH"}) {
            if (SqlText.indexOfTopLevelKeyword(body, keyword) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static String prepare(String sql, int maxRows) {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, was " + maxRows);
        }
        return QuerySafetyGuard.normalize(sql);
    }

    private static String wrapRownum(String body, int maxRows) {
        return "SELECT * FROM (" + body + ") WHERE ROWNUM <= " + maxRows;
    }

    /**
     * Places {@code TOP N} right after the SELECT that opens the main query, after a
     * DISTINCT or ALL quantifier when one is present. For WITH statements the main query
     * is the first SELECT outside the parenthesised CTE bodies. A main query that already
     * has its own TOP or OFFSET clause becomes a derived table under the new TOP, with any CTE prefix kept in front.
     */
    static String injectTop(String body, int maxRows) {
        int select = "SELECT".equals(QuerySafetyGuard.leadingKeyword(body))
                ? 0
                : SqlText.indexOfTopLevelKeyword(body, "SELECT");
        if (select < 0) {
            return wrapTop(body, maxRows);
        }

        int insertAt = select + "SELECT".length();
        int next = skipWhitespace(body, insertAt);
        for (String quantifier : new String[]{"DISTINCT", "ALL"}) {
            if (SqlText.isWordAt(body, next, quantifier)) {
                insertAt = next + quantifier.length();
                next = skipWhitespace(body, insertAt);
                break;
            }
        }
        if (SqlText.isWordAt(body, next, "TOP")
                || SqlText.indexOfTopLevelKeyword(body.substring(select), "OFFSET") >= 0) {
            return body.substring(0, select) + wrapTop(body.substring(select), maxRows);
        }
        return body.substring(0, insertAt) + " TOP " + maxRows + body.substring(insertAt);
    }

    private static String wrapTop(String body, int maxRows) {
        return "SELECT TOP " + maxRows + " * FROM (" + body + ") " + SUBQUERY_ALIAS;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }
}
