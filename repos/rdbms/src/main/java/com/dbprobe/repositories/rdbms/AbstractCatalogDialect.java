package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.CatalogDialect;
import com.dbprobe.core.catalog.Column;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.Index;
import com.dbprobe.core.catalog.IndexAggregator;
import com.dbprobe.core.catalog.IndexColumn;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.Partition;
import com.dbprobe.core.catalog.Statistics;
import com.dbprobe.core.catalog.TableInfo;
import com.dbprobe.core.catalog.TextMatcher;
import com.dbprobe.core.sql.NamedSql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Shared table inspection and metadata search over engine catalog views.
 * <p>
 * Subclasses supply the catalog statements. All of them bind {@code :schema} and
 * {@code :table} and alias their result columns to one vocabulary:
 * <ul>
 *   <li>table comment: {@code table_comment}</li>
 *   <li>columns: {@code column_name}, the engine's type columns, {@code is_nullable},
 *       {@code column_comment}, {@code default_value} (read last)</li>
 *   <li>index columns: {@code index_name}, {@code index_type}, {@code uniqueness},
 *       {@code column_name}, {@code column_position}</li>
 *   <li>partitions: {@code partition_name}, {@code partition_position}, {@code high_value},
 *       {@code num_rows}, {@code compression}</li>
 *   <li>statistics: {@code num_rows}, {@code blocks}, {@code avg_row_len}, {@code last_analyzed}</li>
 *   <li>search: {@code schema_name}, {@code table_name}, {@code table_comment} and the column aliases</li>
 * </ul>
 */
public abstract class AbstractCatalogDialect implements CatalogDialect {

    protected abstract NamedSql tableCommentSql();

    protected abstract NamedSql columnsSql();

    protected abstract NamedSql indexColumnsSql();

    /**
     * Empty for engines whose partitions are not reported.
     */
    protected abstract Optional<NamedSql> partitionsSql();

    protected abstract NamedSql statisticsSql();

    /**
     * Search statement over every column in catalog order. The template sees a boolean
     * {@code schema} flag and must bind {@code :schema} only when it is set.
     */
    protected abstract SqlTemplate searchTemplate();

    /**
     * The engine's own spelling of the current row's column type.
     */
    protected abstract String dataType(ResultSet rs) throws SQLException;

    protected abstract boolean nullable(ResultSet rs) throws SQLException;

    /**
     * Normalizes a user-supplied schema filter before it is bound to the search statement.
     */
    protected String searchSchema(String schema) {
        return schema;
    }

    @Override
    public String pingSql() {
        return "SELECT 1";
    }

    @Override
    public TableInfo inspect(Connection conn, String schema, String table) throws SQLException {
        Map<String, Object> binds = Map.of(
                "schema", Objects.requireNonNull(schema, "schema"),
                "table", Objects.requireNonNull(table, "table"));

        String tableComment = NamedStatements.first(conn, tableCommentSql(), binds,
                rs -> rs.getString("table_comment")).orElse("");
        List<Column> columns = NamedStatements.list(conn, columnsSql(), binds, this::mapColumn);
        List<Index> indexes = IndexAggregator.aggregate(
                NamedStatements.list(conn, indexColumnsSql(), binds, AbstractCatalogDialect::mapIndexColumn));

        Optional<NamedSql> partitionsSql = partitionsSql();
        List<Partition> partitions = partitionsSql.isPresent()
                ? NamedStatements.list(conn, partitionsSql.get(), binds, AbstractCatalogDialect::mapPartition)
                : List.of();

        Statistics statistics = NamedStatements.first(conn, statisticsSql(), binds,
                AbstractCatalogDialect::mapStatistics).orElse(Statistics.empty());

        return new TableInfo(schema, table, kind(), tableComment, columns, indexes, partitions, statistics);
    }

    @Override
    public List<ColumnMatch> search(Connection conn, MetadataQuery query) throws SQLException {
        TextMatcher matcher = new TextMatcher(query.keyword(), query.regex(), identifierCase());
        Map<String, Object> binds = new HashMap<>();
        if (query.schema() != null) {
            binds.put("schema", searchSchema(query.schema()));
        }
        NamedSql sql = searchTemplate().render(Map.of("schema", query.schema() != null));

        List<ColumnMatch> matches = new ArrayList<>();
        try (PreparedStatement stmt = NamedStatements.prepare(conn, sql, binds);
             ResultSet rs = stmt.executeQuery()) {
            while (matches.size() < query.limit() && rs.next()) {
                String table = rs.getString("table_name");
                String column = rs.getString("column_name");
                String tableComment = Rows.getStringOrEmpty(rs, "table_comment");
                String columnComment = Rows.getStringOrEmpty(rs, "column_comment");

                boolean hit = query.searchesNames()
                        && (matcher.matchesIdentifier(column) || matcher.matchesIdentifier(table));
                hit = hit || query.searchesComments()
                        && (matcher.matchesComment(columnComment) || matcher.matchesComment(tableComment));

                if (hit) {
                    matches.add(new ColumnMatch(rs.getString("schema_name"), table, tableComment,
                            column, dataType(rs), nullable(rs), columnComment));
                }
            }
        }
        return matches;
    }

    protected Column mapColumn(ResultSet rs) throws SQLException {
        String name = rs.getString("column_name");
        String dataType = dataType(rs);
        boolean nullable = nullable(rs);
        String comment = rs.getString("column_comment");
        String defaultValue = Rows.getStringOrNull(rs, "default_value");
        return new Column(name, dataType, nullable, defaultValue, comment);
    }

    static IndexColumn mapIndexColumn(ResultSet rs) throws SQLException {
        return new IndexColumn(
                rs.getString("index_name"),
                rs.getString("index_type"),
                rs.getString("uniqueness"),
                rs.getString("column_name"),
                Rows.getInt(rs, "column_position"));
    }

    static Partition mapPartition(ResultSet rs) throws SQLException {
        return new Partition(
                rs.getString("partition_name"),
                Rows.getInt(rs, "partition_position"),
                Rows.getStringOrNull(rs, "high_value"),
                Rows.getLongOrNull(rs, "num_rows"),
                rs.getString("compression"));
    }

    static Statistics mapStatistics(ResultSet rs) throws SQLException {
        return new Statistics(
                Rows.getLongOrNull(rs, "num_rows"),
                Rows.getLongOrNull(rs, "blocks"),
                Rows.getLongOrNull(rs, "avg_row_len"),
                Rows.getTemporalString(rs, "last_analyzed"));
    }
}
