package com.dbprobe.repositories.mysql;

/**
 * INFORMATION_SCHEMA queries for MySQL. Result columns are aliased explicitly because
 * MySQL 8 reports INFORMATION_SCHEMA column labels in upper case.
 */
public final class MySqlQueries {
    private MySqlQueries() {}

    public static final String TABLE_COMMENT = """
            SELECT table_comment AS table_comment
            FROM information_schema.tables
            WHERE table_schema = :schema
              AND table_name = :table
            """;

    public static final String COLUMNS = """
            SELECT column_name AS column_name,
                   column_type AS data_type,
                   is_nullable AS is_nullable,
                   column_comment AS column_comment,
                   column_default AS default_value
            FROM information_schema.columns
            WHERE table_schema = :schema
              AND table_name = :table
            ORDER BY ordinal_position
            """;

    public static final String INDEX_COLUMNS = """
            SELECT index_name AS index_name,
                   index_type AS index_type,
                   CASE WHEN non_unique = 0 THEN 'UNIQUE' ELSE 'NONUNIQUE' END AS uniqueness,
                   column_name AS column_name,
                   seq_in_index AS column_position
            FROM information_schema.statistics
            WHERE table_schema = :schema
              AND table_name = :table
            ORDER BY index_name, seq_in_index
            """;

    public static final String PARTITIONS = """
            SELECT partition_name AS partition_name,
                   partition_ordinal_position AS partition_position,
                   partition_description AS high_value,
                   table_rows AS num_rows,
                   partition_method AS compression
            FROM information_schema.partitions
            WHERE table_schema = :schema
              AND table_name = :table
              AND partition_name IS NOT NULL
            ORDER BY partition_ordinal_position
            """;

    public static final String STATISTICS = """
            SELECT table_rows AS num_rows,
                   data_length AS blocks,
                   avg_row_length AS avg_row_len,
                   update_time AS last_analyzed
            FROM information_schema.tables
            WHERE table_schema = :schema
              AND table_name = :table
            """;

    public static final String SEARCH = """
            SELECT c.table_schema AS schema_name,
                   c.table_name AS table_name,
                   c.column_name AS column_name,
                   c.column_type AS data_type,
                   c.is_nullable AS is_nullable,
                   c.column_comment AS column_comment,
                   t.table_comment AS table_comment
            FROM information_schema.columns c
            LEFT JOIN information_schema.tables t
              ON t.table_schema = c.table_schema
             AND t.table_name = c.table_name
            {{#if schema}}
            WHERE c.table_schema = :schema
            {{/if}}
            ORDER BY c.table_schema, c.table_name, c.ordinal_position
            """;
}
