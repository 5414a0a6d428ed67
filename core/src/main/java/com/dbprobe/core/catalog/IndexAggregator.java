package com.dbprobe.core.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Folds per-column index rows into one {@link Index} per index name.
 * <p>
 * Catalog rows may arrive in any order; columns are always joined in key-position
 * order. Indexes keep the order in which their names were first seen.
 */
public final class IndexAggregator {
    public static final String COLUMN_SEPARATOR = ", ";

    private IndexAggregator() {}

    public static List<Index> aggregate(List<IndexColumn> rows) {
        Map<String, List<IndexColumn>> byName = new LinkedHashMap<>();
        for (IndexColumn row : rows) {
            byName.computeIfAbsent(row.indexName(), k -> new ArrayList<>()).add(row);
        }

        List<Index> indexes = new ArrayList<>(byName.size());
        for (Map.Entry<String, List<IndexColumn>> entry : byName.entrySet()) {
            List<IndexColumn> keyColumns = entry.getValue();
            IndexColumn first = keyColumns.get(0);
            String columns = keyColumns.stream()
                    .sorted(Comparator.comparingInt(IndexColumn::position))
                    .map(IndexColumn::columnName)
                    .collect(Collectors.joining(COLUMN_SEPARATOR));
            indexes.add(new Index(entry.getKey(), first.indexType(), first.uniqueness(), columns));
        }
        return indexes;
    }
}
