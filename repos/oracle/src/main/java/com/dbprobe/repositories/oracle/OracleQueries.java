package com.dbprobe.repositories.oracle;

/**
 * Oracle data dictionary queries. Everything reads the ALL_* views, so results are limited
 * to objects the connected user can see.
 */
public final class OracleQueries {
    private OracleQueries() {}

    public static final String TABLE_COMMENT = """
            SELECT comments AS table_comment
            FROM all_tab_comments
            WHERE owner = :schema
              AND table_name = :table
            """;

    /**
     * DATA_DEFAULT is a LONG column and is selected last so drivers can stream it.
     */
    public static final String COLUMNS = """
            SELECT c.column_name,
                   c.data_type,
                   c.data_length,
                   c.data_precision,
                   c.data_scale,
                   c.nullable AS is_nullable,
                   cc.comments AS column_comment,
                   c.data_default AS default_value
            FROM all_tab_columns c
            LEFT JOIN all_col_comments cc
              ON cc.owner = c.owner
             AND cc.table_name = c.table_name
             AND cc.column_name = c.column_name
            WHERE c.owner = :schema
              AND c.table_name = :table
            ORDER BY c.column_id
            """;

    public static final String INDEX_COLUMNS = """
            SELECT i.index_name,
                   i.index_type,
                   i.uniqueness,
                   ic.column_name,
                   ic.column_position
            FROM all_indexes i
            JOIN all_ind_columns ic
              ON ic.index_owner = i.owner
             AND ic.index_name = i.index_name
            WHERE i.table_owner = :schema
              AND i.table_name = :table
            ORDER BY i.index_name, ic.column_position
            """;

    public static final String PARTITIONS = """
            SELECT partition_name,
                   partition_position,
                   high_value,
                   num_rows,
                   compression
            FROM all_tab_partitions
            WHERE table_owner = :schema
              AND table_name = :table
            ORDER BY partition_position
            """;

    public static final String STATISTICS = """
            SELECT num_rows,
                   blocks,
                   avg_row_len,
                   last_analyzed
            FROM all_tables
            WHERE owner = :schema
              AND table_name = :table
            """;

    public static final String SEARCH = """
            SELECT c.owner AS schema_name,
                   c.table_name,
                   c.column_name,
                   c.data_type,
                   c.data_length,
                   c.data_precision,
                   c.data_scale,
                   c.nullable AS is_nullable,
                   cc.comments AS column_comment,
                   tc.comments AS table_comment
            FROM all_tab_columns c
            LEFT JOIN all_col_comments cc
              ON cc.owner = c.owner
             AND cc.table_name = c.table_name
             AND cc.column_name = c.column_name
            LEFT JOIN all_tab_comments tc
              ON tc.owner = c.owner
             AND tc.table_name = c.table_name
            {{#if schema}}
            WHERE c.owner = :schema
            {{/if}}
            ORDER BY c.owner, c.table_name, c.column_id
            """;

    /**
     * First pass of a source search: only the lines that match one of the criteria.
     */
    public static final String SOURCE_MATCHES = """
            SELECT owner, name, type, line, text
            FROM all_source
            WHERE type IN ({{#each types}}:typ{{@index}}{{#unless @last}}, {{/unless}}{{/each}})
              AND ({{{textCondition}}})
            {{#if schema}}
              AND owner = :schema
            {{/if}}
            ORDER BY owner, name, type, line
            """;

    /**
     * Second pass: the complete source of the selected objects.
     */
    public static final String SOURCE_BODIES = """
            SELECT owner, name, type, line, text
            FROM all_source
            WHERE (owner, name, type) IN ({{#each keys}}(:o{{@index}}, :n{{@index}}, :t{{@index}}){{#unless @last}}, {{/unless}}{{/each}})
            ORDER BY owner, name, type, line
            """;

    public static final String SOURCE_BY_NAME = """
            SELECT owner, name, type, line, text
            FROM all_source
            WHERE name = :objname
              AND type IN ({{#each types}}:typ{{@index}}{{#unless @last}}, {{/unless}}{{/each}})
            {{#if owner}}
              AND owner = :owner
            {{/if}}
            ORDER BY owner, name, type, line
            """;

    public static final String PLAN_OUTPUT = "SELECT plan_table_output FROM TABLE(DBMS_XPLAN.DISPLAY())";
}
