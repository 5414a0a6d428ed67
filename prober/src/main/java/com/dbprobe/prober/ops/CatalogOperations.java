package com.dbprobe.prober.ops;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.DialectUnsupportedException;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.ObjectType;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.ProcedureQuery;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.TableInfo;
import com.dbprobe.repositories.oracle.ProcedureSourceSearcher;
import com.dbprobe.repositories.rdbms.GuardedQueryRunner;
import com.dbprobe.repositories.rdbms.StatementListener;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * The operations dbprobe offers, each against a resolved dialect and an open connection.
 * Nothing here prints or reads configuration; the caller owns the connection.
 */
public class CatalogOperations {
    private final GuardedQueryRunner runner;

    public CatalogOperations() {
        this(new GuardedQueryRunner());
    }

    public CatalogOperations(GuardedQueryRunner runner) {
        this.runner = runner;
    }

    public TableInfo inspectTable(DialectKind dialect, Connection conn, String schema, String table)
            throws SQLException {
        return Dialects.of(dialect).inspect(conn, schema, table);
    }

    public List<ColumnMatch> searchMetadata(DialectKind dialect, Connection conn, MetadataQuery query)
            throws SQLException {
        return Dialects.of(dialect).search(conn, query);
    }

    public List<ProcedureMatch> searchProcedures(DialectKind dialect, Connection conn, ProcedureQuery query,
                                                 StatementListener listener) throws SQLException {
        return procedureSearcher(dialect, listener).search(conn, query);
    }

    /**
     * Full source of the objects named {@code objectName}, which may be qualified as {@code OWNER.NAME}.
     */
    public List<ProcedureMatch> fetchProcedure(DialectKind dialect, Connection conn, String objectName, String schema,
                                               List<ObjectType> objectTypes, int lineLimit,
                                               StatementListener listener) throws SQLException {
        return procedureSearcher(dialect, listener).fetchByName(conn, objectName, schema, objectTypes, lineLimit);
    }

    public QueryResult runGuardedQuery(DialectKind dialect, Connection conn, String sql, int maxRows)
            throws SQLException {
        return runner.run(Dialects.of(dialect), conn, sql, maxRows);
    }

    public ExecutionPlan explain(DialectKind dialect, Connection conn, String sql) throws SQLException {
        return runner.explain(Dialects.of(dialect), conn, sql);
    }

    private static ProcedureSourceSearcher procedureSearcher(DialectKind dialect, StatementListener listener) {
        return switch (dialect) {
            case ORACLE -> new ProcedureSourceSearcher(listener);
            case MYSQL, POSTGRESQL, SQLSERVER -> throw new DialectUnsupportedException(dialect, "search-procedures");
        };
    }
}
