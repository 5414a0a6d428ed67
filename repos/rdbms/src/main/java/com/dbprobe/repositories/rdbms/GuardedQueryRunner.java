package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.CatalogDialect;
import com.dbprobe.core.SafetyViolationException;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.sql.QueryPaginator;
import com.dbprobe.core.sql.QuerySafetyGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Executes caller-supplied SQL only after it passes {@link QuerySafetyGuard}, with the
 * result capped by the engine's pagination idiom.
 */
public class GuardedQueryRunner {
    private static final Logger logger = LoggerFactory.getLogger(GuardedQueryRunner.class);

    public QueryResult run(CatalogDialect dialect, Connection conn, String sql, int maxRows) throws SQLException {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive, was " + maxRows);
        }
        if (!dialect.isReadOnly(sql)) {
            throw new SafetyViolationException(sql);
        }

        int fetch = maxRows + 1;
        String capped = capped(dialect, sql, fetch);
        logger.debug("Running capped query on {}: {}", dialect.kind(), capped);

        conn.setReadOnly(true);
        long started = System.nanoTime();
        try (PreparedStatement stmt = conn.prepareStatement(capped)) {
            stmt.setMaxRows(fetch);
            try (ResultSet rs = stmt.executeQuery()) {
                List<String> columns = columnLabels(rs.getMetaData());
                List<List<Object>> rows = new ArrayList<>();
                while (rows.size() < fetch && rs.next()) {
                    List<Object> row = new ArrayList<>(columns.size());
                    for (int i = 1; i <= columns.size(); i++) {
                        row.add(Rows.displayValue(rs.getObject(i)));
                    }
                    rows.add(row);
                }
                boolean truncated = rows.size() > maxRows;
                if (truncated) {
                    rows = new ArrayList<>(rows.subList(0, maxRows));
                }
                double elapsedMs = Math.round((System.nanoTime() - started) / 10_000.0) / 100.0;
                logger.debug("Query returned {} rows in {} ms", rows.size(), elapsedMs);
                return new QueryResult(columns, rows, rows.size(), elapsedMs, truncated, maxRows);
            }
        }
    }

    /**
     * One row past the cap is fetched so that a full page can be told apart from a cut one.
     * A statement with its own row limit is selected from as a derived table; anything else
     * gets the engine's plain cap.
     */
    private static String capped(CatalogDialect dialect, String sql, int fetch) {
        if (!"EXPLAIN".equals(QuerySafetyGuard.leadingKeyword(sql)) && QueryPaginator.hasOwnRowLimit(sql)) {
            return QueryPaginator.capAsSubquery(sql, fetch, dialect.kind());
        }
        return dialect.cap(sql, fetch);
    }

    /**
     * Runs the engine's plan statements for a read-only query and reads the plan back,
     * one line per plan row.
     */
    public ExecutionPlan explain(CatalogDialect dialect, Connection conn, String sql) throws SQLException {
        if (!dialect.isReadOnly(sql)) {
            throw new SafetyViolationException(sql);
        }
        String statement = QuerySafetyGuard.normalize(sql);
        List<String> steps = dialect.explain(statement);

        for (String step : steps.subList(0, steps.size() - 1)) {
            logger.debug("Plan step on {}: {}", dialect.kind(), step);
            try (Statement stmt = conn.createStatement()) {
                stmt.execute(step);
            }
        }

        String planQuery = steps.get(steps.size() - 1);
        logger.debug("Reading plan on {}: {}", dialect.kind(), planQuery);
        List<String> lines = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(planQuery)) {
            List<String> columns = columnLabels(rs.getMetaData());
            if (columns.size() > 1) {
                lines.add(String.join(" | ", columns));
            }
            while (rs.next()) {
                StringJoiner line = new StringJoiner(" | ");
                for (int i = 1; i <= columns.size(); i++) {
                    Object value = Rows.displayValue(rs.getObject(i));
                    line.add(value == null ? "NULL" : value.toString());
                }
                lines.add(line.toString());
            }
        }
        return new ExecutionPlan(dialect.kind(), statement, lines, dialect.analyzePlan(lines));
    }

    private static List<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        int count = meta.getColumnCount();
        List<String> labels = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            labels.add(meta.getColumnLabel(i));
        }
        return labels;
    }
}
