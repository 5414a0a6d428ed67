package com.dbprobe.core;

import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.PlanIssue;
import com.dbprobe.core.catalog.TableInfo;
import com.dbprobe.core.sql.ParamStyle;
import com.dbprobe.core.sql.QueryPaginator;
import com.dbprobe.core.sql.QuerySafetyGuard;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Everything dbprobe needs to know about one database engine.
 * There is exactly one implementation per {@link DialectKind}.
 */
public interface CatalogDialect {

    DialectKind kind();

    /**
     * How the engine folds unquoted identifiers; metadata search compares names in this case.
     */
    IdentifierCase identifierCase();

    /**
     * Describes one table. A table that does not exist yields empty columns, indexes and
     * partitions and empty statistics rather than an error.
     */
    TableInfo inspect(Connection connection, String schema, String table) throws SQLException;

    /**
     * Scans column and table catalogs for names or comments matching the query, in catalog
     * order, stopping after {@link MetadataQuery#limit()} matches.
     */
    List<ColumnMatch> search(Connection connection, MetadataQuery query) throws SQLException;

    /**
     * Statement used to check that a connection is alive.
     */
    String pingSql();

    /**
     * Statements that produce an execution plan for {@code sql}. Every statement but the last
     * is executed for its side effect; the last one returns the plan rows.
     *
     * @throws DialectUnsupportedException when the engine has no plan support here
     */
    List<String> explain(String sql);

    /**
     * Reads the plan lines produced by {@link #explain(String)} and reports anything worth a
     * second look. Engines without plan analysis report nothing.
     */
    default List<PlanIssue> analyzePlan(List<String> planLines) {
        return List.of();
    }

    default boolean isReadOnly(String sql) {
        return QuerySafetyGuard.isReadOnly(sql);
    }

    default String cap(String sql, int maxRows) {
        return QueryPaginator.cap(sql, maxRows, kind());
    }

    default ParamStyle paramStyle() {
        return ParamStyle.of(kind());
    }
}
