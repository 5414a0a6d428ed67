package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.catalog.TextMatcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds the source lines returned by the first pass of a procedure search into per-object
 * facts: whether any line matched the table criterion, whether any matched the text
 * criterion, and which lines matched either.
 * <p>
 * An object is selected only when it satisfies every criterion that was supplied, so a
 * search for a table and a text keeps the programs that mention both, possibly on
 * different lines.
 */
public class SourceMatchAccumulator {
    public static final int MAX_LINE_NUMBERS = 100;

    private final TextMatcher tableMatcher;
    private final TextMatcher textMatcher;
    private final Map<SourceObjectKey, ObjectMatches> objects = new HashMap<>();

    private static final class ObjectMatches {
        boolean table;
        boolean text;
        final List<Integer> lines = new ArrayList<>();
    }

    /**
     * @param tableName table criterion, or null
     * @param text      text criterion, or null
     */
    public SourceMatchAccumulator(String tableName, String text, boolean regex) {
        this.tableMatcher = matcher(tableName, regex);
        this.textMatcher = matcher(text, regex);
    }

    public void accept(SourceObjectKey key, int line, String text) {
        boolean tableHit = tableMatcher != null && tableMatcher.matchesComment(text);
        boolean textHit = textMatcher != null && textMatcher.matchesComment(text);

        ObjectMatches matches = objects.computeIfAbsent(key, k -> new ObjectMatches());
        matches.table |= tableHit;
        matches.text |= textHit;
        if (tableHit || textHit) {
            matches.lines.add(line);
        }
    }

    /**
     * Objects meeting every supplied criterion in catalog order, at most {@code limit} of them.
     */
    public List<SourceObjectKey> selected(int limit) {
        return objects.entrySet().stream()
                .filter(e -> (tableMatcher == null || e.getValue().table)
                        && (textMatcher == null || e.getValue().text))
                .map(Map.Entry::getKey)
                .sorted(SourceObjectKey.CATALOG_ORDER)
                .limit(limit)
                .toList();
    }

    public int matchCount(SourceObjectKey key) {
        ObjectMatches matches = objects.get(key);
        return matches == null ? 0 : matches.lines.size();
    }

    /**
     * Matching line numbers in line order, at most {@value #MAX_LINE_NUMBERS}.
     */
    public List<Integer> matchingLines(SourceObjectKey key) {
        ObjectMatches matches = objects.get(key);
        if (matches == null) {
            return List.of();
        }
        List<Integer> lines = new ArrayList<>(matches.lines);
        lines.sort(null);
        return List.copyOf(lines.subList(0, Math.min(lines.size(), MAX_LINE_NUMBERS)));
    }

    private static TextMatcher matcher(String criterion, boolean regex) {
        if (criterion == null) {
            return null;
        }
        return new TextMatcher(regex ? criterion : criterion.trim(), regex, IdentifierCase.UPPER);
    }
}
