package com.dbprobe.repositories.sqlserver;

/**
 * sys catalog view queries for SQL Server. Comments are MS_Description extended properties.
 */
public final class SqlServerQueries {
    private SqlServerQueries() {}

    public static final String TABLE_COMMENT = """
            SELECT CAST(ep.value AS NVARCHAR(MAX)) AS table_comment
            FROM sys.extended_properties ep
            JOIN sys.tables t ON ep.major_id = t.object_id
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            WHERE s.name = :schema
              AND t.name = :table
              AND ep.class = 1
              AND ep.minor_id = 0
              AND ep.name = 'MS_Description'
            """;

    public static final String COLUMNS = """
            SELECT c.name AS column_name,
                   TYPE_NAME(c.user_type_id) AS type_name,
                   c.max_length AS max_length,
                   c.precision AS numeric_precision,
                   c.scale AS numeric_scale,
                   c.is_nullable AS is_nullable,
                   CAST(ep.value AS NVARCHAR(MAX)) AS column_comment,
                   OBJECT_DEFINITION(c.default_object_id) AS default_value
            FROM sys.columns c
            JOIN sys.tables t ON c.object_id = t.object_id
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            LEFT JOIN sys.extended_properties ep
              ON ep.major_id = c.object_id
             AND ep.minor_id = c.column_id
             AND ep.class = 1
             AND ep.name = 'MS_Description'
            WHERE s.name = :schema
              AND t.name = :table
            ORDER BY c.column_id
            """;

    /**
     * Key columns carry their key ordinal; included columns (key_ordinal 0) sort after the keys.
     */
    public static final String INDEX_COLUMNS = """
            SELECT i.name AS index_name,
                   i.type_desc AS index_type,
                   CASE WHEN i.is_unique = 1 THEN 'UNIQUE' ELSE 'NONUNIQUE' END AS uniqueness,
                   c.name AS column_name,
                   CASE WHEN ic.key_ordinal > 0 THEN ic.key_ordinal ELSE 1000 + ic.index_column_id END AS column_position
            FROM sys.indexes i
            JOIN sys.tables t ON i.object_id = t.object_id
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            JOIN sys.index_columns ic ON ic.object_id = i.object_id AND ic.index_id = i.index_id
            JOIN sys.columns c ON c.object_id = ic.object_id AND c.column_id = ic.column_id
            WHERE s.name = :schema
              AND t.name = :table
            ORDER BY i.name, column_position
            """;

    /**
     * Only tables stored on a partition scheme have rows here.
     */
    public static final String PARTITIONS = """
            SELECT 'Partition_' + CAST(p.partition_number AS VARCHAR(10)) AS partition_name,
                   p.partition_number AS partition_position,
                   CAST(NULL AS NVARCHAR(4000)) AS high_value,
                   p.rows AS num_rows,
                   ps.name AS compression
            FROM sys.partitions p
            JOIN sys.tables t ON p.object_id = t.object_id
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            JOIN sys.indexes i ON p.object_id = i.object_id AND p.index_id = i.index_id
            JOIN sys.partition_schemes ps ON i.data_space_id = ps.data_space_id
            WHERE s.name = :schema
              AND t.name = :table
              AND i.index_id <= 1
            ORDER BY p.partition_number
            """;

    /**
     * Sizes are in KB; rows are counted on the heap or clustered index only.
     */
    public static final String STATISTICS = """
            SELECT SUM(CASE WHEN i.index_id <= 1 AND a.type = 1 THEN p.rows ELSE 0 END) AS num_rows,
                   SUM(a.total_pages) * 8 AS blocks,
                   SUM(a.total_pages) * 8
                       / NULLIF(SUM(CASE WHEN i.index_id <= 1 AND a.type = 1 THEN p.rows ELSE 0 END), 0) AS avg_row_len,
                   MAX(STATS_DATE(i.object_id, i.index_id)) AS last_analyzed
            FROM sys.tables t
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            JOIN sys.indexes i ON t.object_id = i.object_id
            JOIN sys.partitions p ON i.object_id = p.object_id AND i.index_id = p.index_id
            JOIN sys.allocation_units a ON p.partition_id = a.container_id
            WHERE s.name = :schema
              AND t.name = :table
            GROUP BY t.object_id
            """;

    public static final String SEARCH = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   c.name AS column_name,
                   TYPE_NAME(c.user_type_id) AS type_name,
                   c.max_length AS max_length,
                   c.precision AS numeric_precision,
                   c.scale AS numeric_scale,
                   c.is_nullable AS is_nullable,
                   CAST(ep_col.value AS NVARCHAR(MAX)) AS column_comment,
                   CAST(ep_tbl.value AS NVARCHAR(MAX)) AS table_comment
            FROM sys.columns c
            JOIN sys.tables t ON c.object_id = t.object_id
            JOIN sys.schemas s ON t.schema_id = s.schema_id
            LEFT JOIN sys.extended_properties ep_col
              ON ep_col.major_id = c.object_id
             AND ep_col.minor_id = c.column_id
             AND ep_col.class = 1
             AND ep_col.name = 'MS_Description'
            LEFT JOIN sys.extended_properties ep_tbl
              ON ep_tbl.major_id = t.object_id
             AND ep_tbl.minor_id = 0
             AND ep_tbl.class = 1
             AND ep_tbl.name = 'MS_Description'
            {{#if schema}}
            WHERE s.name = :schema
            {{/if}}
            ORDER BY s.name, t.name, c.column_id
            """;
}
