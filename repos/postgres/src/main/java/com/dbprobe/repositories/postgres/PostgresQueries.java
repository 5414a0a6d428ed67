package com.dbprobe.repositories.postgres;

/**
 * pg_catalog queries for PostgreSQL table inspection and metadata search.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    public static final String TABLE_COMMENT = """
            SELECT obj_description(c.oid, 'pg_class') AS table_comment
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE n.nspname = :schema
              AND c.relname = :table
            """;

    public static final String COLUMNS = """
            SELECT a.attname AS column_name,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS is_nullable,
                   col_description(a.attrelid, a.attnum) AS column_comment,
                   pg_get_expr(d.adbin, d.adrelid) AS default_value
            FROM pg_attribute a
            JOIN pg_class c ON c.oid = a.attrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            WHERE n.nspname = :schema
              AND c.relname = :table
              AND a.attnum > 0
              AND NOT a.attisdropped
            ORDER BY a.attnum
            """;

    /**
     * One row per key column; expression keys (attnum 0) have no column and are skipped.
     */
    public static final String INDEX_COLUMNS = """
            SELECT i.relname AS index_name,
                   am.amname AS index_type,
                   CASE WHEN ix.indisunique THEN 'UNIQUE' ELSE 'NONUNIQUE' END AS uniqueness,
                   a.attname AS column_name,
                   k.ord AS column_position
            FROM pg_index ix
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_class i ON i.oid = ix.indexrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_am am ON am.oid = i.relam
            CROSS JOIN LATERAL unnest(ix.indkey::int2[]) WITH ORDINALITY AS k(attnum, ord)
            JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = k.attnum
            WHERE n.nspname = :schema
              AND t.relname = :table
            ORDER BY i.relname, k.ord
            """;

    public static final String STATISTICS = """
            SELECT s.n_live_tup AS num_rows,
                   pg_total_relation_size(s.relid) AS blocks,
                   NULL::bigint AS avg_row_len,
                   GREATEST(s.last_analyze, s.last_autoanalyze) AS last_analyzed
            FROM pg_stat_user_tables s
            WHERE s.schemaname = :schema
              AND s.relname = :table
            """;

    public static final String SEARCH = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   a.attname AS column_name,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS is_nullable,
                   col_description(a.attrelid, a.attnum) AS column_comment,
                   obj_description(c.oid, 'pg_class') AS table_comment
            FROM pg_attribute a
            JOIN pg_class c ON c.oid = a.attrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE a.attnum > 0
              AND NOT a.attisdropped
              AND c.relkind IN ('r', 'v', 'm')
            {{#if schema}}
              AND n.nspname = :schema
            {{else}}
              AND n.nspname NOT IN ('pg_catalog', 'information_schema')
            {{/if}}
            ORDER BY n.nspname, c.relname, a.attnum
            """;
}
