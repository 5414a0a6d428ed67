package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.CatalogDialect;
import com.dbprobe.core.DialectKind;
import com.dbprobe.core.SafetyViolationException;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.repos.certification.ScriptedJdbc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;

import static com.dbprobe.repos.certification.ScriptedJdbc.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

class GuardedQueryRunnerTest {

    private final GuardedQueryRunner runner = new GuardedQueryRunner();
    private ScriptedJdbc jdbc;

    @BeforeEach
    void setUp() {
        jdbc = new ScriptedJdbc();
    }

    private static CatalogDialect dialect(DialectKind kind) {
        CatalogDialect dialect = mock(CatalogDialect.class, Mockito.CALLS_REAL_METHODS);
        doReturn(kind).when(dialect).kind();
        return dialect;
    }

    @Test
    void writesAreRejectedBeforeTheConnectionIsUsed() {
        CatalogDialect postgres = dialect(DialectKind.POSTGRESQL);

        assertThrows(SafetyViolationException.class,
                () -> runner.run(postgres, jdbc.connection(), "DELETE FROM users", 10));
        assertThrows(SafetyViolationException.class,
                () -> runner.run(postgres, jdbc.connection(), "SELECT 1; DROP TABLE users", 10));

        assertTrue(jdbc.executed().isEmpty());
        assertFalse(jdbc.readOnlyRequested());
    }

    @Test
    void nonPositiveRowCapIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> runner.run(dialect(DialectKind.MYSQL), jdbc.connection(), "SELECT 1", 0));
    }

    @Test
    void plainQueriesGetABareLimitOneRowPastTheCap() throws SQLException {
        runner.run(dialect(DialectKind.MYSQL), jdbc.connection(), "SELECT a.id, b.id FROM a JOIN b ON b.a_id = a.id;", 2);

        assertEquals("SELECT a.id, b.id FROM a JOIN b ON b.a_id = a.id LIMIT 3", jdbc.lastExecuted().sql());
        assertTrue(jdbc.readOnlyRequested());
    }

    @Test
    void queriesWithTheirOwnLimitAreWrappedAsLimitedSubqueries() throws SQLException {
        runner.run(dialect(DialectKind.POSTGRESQL), jdbc.connection(), "SELECT id, name FROM users ORDER BY id LIMIT 50", 2);

        assertEquals("SELECT * FROM (SELECT id, name FROM users ORDER BY id LIMIT 50) _limited LIMIT 3",
                jdbc.lastExecuted().sql());
    }

    @Test
    void oracleQueriesAreCappedWithRownum() throws SQLException {
        runner.run(dialect(DialectKind.ORACLE), jdbc.connection(), "SELECT * FROM dual", 5);

        assertEquals("SELECT * FROM (SELECT * FROM dual) WHERE ROWNUM <= 6", jdbc.lastExecuted().sql());
    }

    @Test
    void explainStatementsGetABareLimit() throws SQLException {
        runner.run(dialect(DialectKind.MYSQL), jdbc.connection(), "EXPLAIN SELECT * FROM orders", 5);

        assertEquals("EXPLAIN SELECT * FROM orders LIMIT 6", jdbc.lastExecuted().sql());
    }

    @Test
    void resultIsTruncatedAtTheCap() throws SQLException {
        jdbc.on("FROM users",
                row("id", 1, "name", "an"),
                row("id", 2, "name", "binh"),
                row("id", 3, "name", "chi"));

        QueryResult result = runner.run(dialect(DialectKind.POSTGRESQL), jdbc.connection(),
                "SELECT id, name FROM users", 2);

        assertEquals(List.of("id", "name"), result.columns());
        assertEquals(2, result.rowCount());
        assertEquals(List.of(1, "an"), result.rows().get(0));
        assertTrue(result.truncated());
        assertEquals(2, result.rowLimit());
        assertTrue(result.executionTimeMs() >= 0);
    }

    @Test
    void resultOfExactlyTheCapIsNotTruncated() throws SQLException {
        jdbc.on("FROM users", row("id", 1), row("id", 2));

        QueryResult result = runner.run(dialect(DialectKind.POSTGRESQL), jdbc.connection(),
                "SELECT id FROM users", 2);

        assertEquals(2, result.rowCount());
        assertFalse(result.truncated());
    }

    @Test
    void shortResultIsNotTruncated() throws SQLException {
        jdbc.on("FROM users", row("id", 1));

        QueryResult result = runner.run(dialect(DialectKind.SQLSERVER), jdbc.connection(),
                "SELECT id FROM users", 50);

        assertEquals("SELECT TOP 51 id FROM users", jdbc.lastExecuted().sql());
        assertEquals(1, result.rowCount());
        assertFalse(result.truncated());
    }

    @Test
    void cellsAreConvertedForDisplay() throws SQLException {
        jdbc.on("FROM files", row("id", 7L, "digest", new byte[]{0x0a, (byte) 0xff}, "note", null, "ok", true));

        QueryResult result = runner.run(dialect(DialectKind.MYSQL), jdbc.connection(),
                "SELECT id, digest, note, ok FROM files", 10);

        assertEquals(Arrays.asList(7L, "0x0aff", null, true), result.rows().get(0));
    }

    @Test
    void planStepsRunInOrderAndLastOneIsRead() throws SQLException {
        CatalogDialect oracle = dialect(DialectKind.ORACLE);
        doReturn(List.of("EXPLAIN PLAN FOR SELECT * FROM dual", "SELECT plan_table_output FROM TABLE(DBMS_XPLAN.DISPLAY())"))
                .when(oracle).explain(anyString());
        jdbc.on("DBMS_XPLAN",
                row("PLAN_TABLE_OUTPUT", "Plan hash value: 272002086"),
                row("PLAN_TABLE_OUTPUT", "|   0 | SELECT STATEMENT  |      |     1 |     2 |"));

        ExecutionPlan plan = runner.explain(oracle, jdbc.connection(), "SELECT * FROM dual;");

        assertEquals(2, jdbc.executed().size());
        assertEquals("EXPLAIN PLAN FOR SELECT * FROM dual", jdbc.executed().get(0).sql());
        assertEquals("SELECT * FROM dual", plan.statement());
        assertEquals(DialectKind.ORACLE, plan.dialect());
        assertEquals(List.of("Plan hash value: 272002086", "|   0 | SELECT STATEMENT  |      |     1 |     2 |"),
                plan.lines());
        assertTrue(plan.issues().isEmpty());
        assertFalse(jdbc.readOnlyRequested());
    }

    @Test
    void multiColumnPlansGetAHeaderLine() throws SQLException {
        CatalogDialect mysql = dialect(DialectKind.MYSQL);
        doReturn(List.of("EXPLAIN SELECT * FROM orders")).when(mysql).explain(anyString());
        jdbc.on("EXPLAIN SELECT", row("id", 1, "select_type", "SIMPLE", "Extra", null));

        ExecutionPlan plan = runner.explain(mysql, jdbc.connection(), "SELECT * FROM orders");

        assertEquals(List.of("id | select_type | Extra", "1 | SIMPLE | NULL"), plan.lines());
    }

    @Test
    void explainRejectsWrites() {
        CatalogDialect mysql = dialect(DialectKind.MYSQL);

        assertThrows(SafetyViolationException.class,
                () -> runner.explain(mysql, jdbc.connection(), "UPDATE orders SET total = 0"));
        assertTrue(jdbc.executed().isEmpty());
    }
}
