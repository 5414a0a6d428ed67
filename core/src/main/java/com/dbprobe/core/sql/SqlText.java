package com.dbprobe.core.sql;

import java.util.Locale;

/**
 * Lexical helpers over raw SQL text. Quoted literals and quoted identifiers are
 * skipped so that comment markers, semicolons and keywords inside them are not
 * mistaken for structure.
 * <p>
 * Quotes are read with the standard doubled-quote escape unless a method takes a
 * {@code backslashEscapes} flag, which reads {@code \'} as an escaped quote the way MySQL
 * strings and PostgreSQL {@code E'...'} strings do.
 */
public final class SqlText {
    private SqlText() {}

    /**
     * Removes {@code --} line comments and {@code /* *}{@code /} block comments outside quotes.
     * A removed comment leaves a single space so adjacent tokens stay apart.
     */
    public static String stripComments(String sql) {
        return stripComments(sql, false);
    }

    static String stripComments(String sql, boolean backslashEscapes) {
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = skipQuoted(sql, i, backslashEscapes);
                out.append(sql, i, end);
                i = end;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol;
                out.append(' ');
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                i = close < 0 ? n : close + 2;
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Trims whitespace and any trailing statement terminators.
     */
    public static String stripTerminators(String sql) {
        String trimmed = sql.strip();
        int end = trimmed.length();
        while (end > 0 && (trimmed.charAt(end - 1) == ';' || Character.isWhitespace(trimmed.charAt(end - 1)))) {
            end--;
        }
        return trimmed.substring(0, end);
    }

    /**
     * True when {@code target} occurs outside quoted text.
     */
    public static boolean containsUnquoted(String sql, char target) {
        return containsUnquoted(sql, target, false);
    }

    static boolean containsUnquoted(String sql, char target, boolean backslashEscapes) {
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, backslashEscapes);
            } else if (c == target) {
                return true;
            } else {
                i++;
            }
        }
        return false;
    }

    /**
     * Finds the first occurrence of {@code keyword} as a whole word, outside quotes and
     * outside parentheses.
     *
     * @return the start index, or -1
     */
    public static int indexOfTopLevelKeyword(String sql, String keyword) {
        String upper = keyword.toUpperCase(Locale.ROOT);
        int depth = 0;
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i);
                continue;
            }
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && isWordAt(sql, i, upper)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * True when {@code upperWord} starts at {@code index} and is delimited by non-identifier characters.
     */
    static boolean isWordAt(String sql, int index, String upperWord) {
        int end = index + upperWord.length();
        if (end > sql.length() || !sql.regionMatches(true, index, upperWord, 0, upperWord.length())) {
            return false;
        }
        boolean startBoundary = index == 0 || !isIdentifierPart(sql.charAt(index - 1));
        boolean endBoundary = end == sql.length() || !isIdentifierPart(sql.charAt(end));
        return startBoundary && endBoundary;
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '#';
    }

    /**
     * Returns the index just past the quoted section starting at {@code start}.
     * Doubled quote characters are escapes; an unterminated quote runs to the end.
     */
    static int skipQuoted(String sql, int start) {
        return skipQuoted(sql, start, false);
    }

    /**
     * As {@link #skipQuoted(String, int)}; with {@code backslashEscapes} a backslash also
     * escapes the character after it.
     */
    static int skipQuoted(String sql, int start, boolean backslashEscapes) {
        char quote = sql.charAt(start);
        int i = start + 1;
        int n = sql.length();
        while (i < n) {
            if (backslashEscapes && sql.charAt(i) == '\\') {
                i += 2;
                continue;
            }
            if (sql.charAt(i) == quote) {
                if (i + 1 < n && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return Math.min(i, n);
    }
}
