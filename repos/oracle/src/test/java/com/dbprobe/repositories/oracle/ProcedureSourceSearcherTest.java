package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.ObjectType;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.ProcedureQuery;
import com.dbprobe.core.catalog.SourceLine;
import com.dbprobe.repos.certification.ScriptedJdbc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.dbprobe.repos.certification.ScriptedJdbc.row;
import static org.junit.jupiter.api.Assertions.*;

class ProcedureSourceSearcherTest {
    private static final String MATCH_PASS = "FROM all_source WHERE type IN";
    private static final String BODY_PASS = "WHERE (owner, name, type) IN";
    private static final List<Object> ALL_TYPES = List.of("PROCEDURE", "PACKAGE", "PACKAGE BODY", "FUNCTION");

    private ScriptedJdbc jdbc;

    @BeforeEach
    void setUp() {
        jdbc = new ScriptedJdbc();
    }

    private static Map<String, Object> source(String owner, String name, String type, int line, String text) {
        return row("owner", owner, "name", name, "type", type, "line", new BigDecimal(line), "text", text);
    }

    private static ProcedureQuery query(String table, String text) {
        return new ProcedureQuery(table, text, null, List.of(), false, 100, 0);
    }

    @Test
    void objectsMustMatchEverySuppliedCriterion() throws SQLException {
        jdbc.on(MATCH_PASS,
                        source("APP", "PKG_A", "PACKAGE BODY", 10, "  INSERT INTO DIM_CUSTOMER (id)"),
                        source("APP", "PKG_A", "PACKAGE BODY", 25, "  COMMIT;"),
                        source("APP", "PRC_B", "PROCEDURE", 3, "  SELECT * FROM dim_customer"))
                .on(BODY_PASS,
                        source("APP", "PKG_A", "PACKAGE BODY", 1, "PACKAGE BODY pkg_a AS   "),
                        source("APP", "PKG_A", "PACKAGE BODY", 10, "  INSERT INTO DIM_CUSTOMER (id)"),
                        source("APP", "PKG_A", "PACKAGE BODY", 25, "  COMMIT;\n"));

        List<ProcedureMatch> matches = new ProcedureSourceSearcher().search(jdbc.connection(),
                query(" dim_customer ", "commit"));

        assertEquals(1, matches.size());
        ProcedureMatch match = matches.get(0);
        assertEquals("APP", match.schema());
        assertEquals("PKG_A", match.name());
        assertEquals(ObjectType.PACKAGE_BODY, match.type());
        assertEquals(2, match.matchCount());
        assertEquals(List.of(10, 25), match.matchingLineNumbers());
        assertEquals(List.of(
                new SourceLine(1, "PACKAGE BODY pkg_a AS"),
                new SourceLine(10, "  INSERT INTO DIM_CUSTOMER (id)"),
                new SourceLine(25, "  COMMIT;")), match.lines());

        List<Object> firstPass = new ArrayList<>(ALL_TYPES);
        firstPass.add("DIM_CUSTOMER");
        firstPass.add("COMMIT");
        assertEquals(firstPass, jdbc.executedMatching(MATCH_PASS).binds());
        assertEquals(List.of("APP", "PKG_A", "PACKAGE BODY"), jdbc.executedMatching(BODY_PASS).binds());
    }

    @Test
    void matchingLinesAreAlwaysPresentInFullSource() throws SQLException {
        jdbc.on(MATCH_PASS,
                        source("APP", "PRC_LOAD", "PROCEDURE", 2, "MERGE INTO fact_order fo"),
                        source("APP", "PRC_LOAD", "PROCEDURE", 7, "DELETE FROM fact_order"))
                .on(BODY_PASS,
                        source("APP", "PRC_LOAD", "PROCEDURE", 1, "PROCEDURE prc_load IS"),
                        source("APP", "PRC_LOAD", "PROCEDURE", 2, "MERGE INTO fact_order fo"),
                        source("APP", "PRC_LOAD", "PROCEDURE", 7, "DELETE FROM fact_order"),
                        source("APP", "PRC_LOAD", "PROCEDURE", 8, "END;"));

        ProcedureMatch match = new ProcedureSourceSearcher().search(jdbc.connection(),
                query("FACT_ORDER", null)).get(0);

        List<Integer> sourceLines = match.lines().stream().map(SourceLine::line).toList();
        assertTrue(sourceLines.containsAll(match.matchingLineNumbers()));
        assertEquals(4, match.lines().size());
    }

    @Test
    void noCriteriaRunsNothing() throws SQLException {
        List<ProcedureMatch> matches = new ProcedureSourceSearcher().search(jdbc.connection(), query(null, "  "));

        assertTrue(matches.isEmpty());
        assertTrue(jdbc.executed().isEmpty());
    }

    @Test
    void regexModeBindsPatternAndUpperCasesOwner() throws SQLException {
        ProcedureQuery query = new ProcedureQuery("dim_cust.*", null, "app",
                List.of(ObjectType.FUNCTION), true, 100, 0);

        List<ProcedureMatch> matches = new ProcedureSourceSearcher().search(jdbc.connection(), query);

        assertTrue(matches.isEmpty());
        assertEquals(1, jdbc.executed().size());
        ScriptedJdbc.Executed executed = jdbc.lastExecuted();
        assertTrue(executed.sql().contains("REGEXP_LIKE(text, ?, 'i')"));
        assertEquals(List.of("FUNCTION", "dim_cust.*", "APP"), executed.binds());
    }

    @Test
    void objectLimitKeepsTheFirstObjectsInCatalogOrder() throws SQLException {
        jdbc.on(MATCH_PASS,
                source("ZED", "P1", "PROCEDURE", 1, "x_table"),
                source("APP", "PKG_B", "PACKAGE", 1, "x_table"),
                source("APP", "PKG_B", "PACKAGE BODY", 1, "x_table"),
                source("APP", "PKG_A", "PACKAGE BODY", 1, "x_table"));

        List<ProcedureMatch> matches = new ProcedureSourceSearcher().search(jdbc.connection(),
                new ProcedureQuery("X_TABLE", null, null, null, false, 2, 0));

        assertEquals(List.of("PKG_A", "PKG_B"), matches.stream().map(ProcedureMatch::name).toList());
        assertEquals(List.of("APP", "PKG_A", "PACKAGE BODY", "APP", "PKG_B", "PACKAGE"),
                jdbc.executedMatching(BODY_PASS).binds());
    }

    @Test
    void lineLimitCutsSourceButNotMatchCount() throws SQLException {
        jdbc.on(MATCH_PASS,
                        source("APP", "F_CALC", "FUNCTION", 3, "tax"),
                        source("APP", "F_CALC", "FUNCTION", 4, "tax"))
                .on(BODY_PASS,
                        source("APP", "F_CALC", "FUNCTION", 1, "FUNCTION f_calc"),
                        source("APP", "F_CALC", "FUNCTION", 2, "RETURN NUMBER IS"),
                        source("APP", "F_CALC", "FUNCTION", 3, "tax"),
                        source("APP", "F_CALC", "FUNCTION", 4, "tax"));

        ProcedureMatch match = new ProcedureSourceSearcher().search(jdbc.connection(),
                new ProcedureQuery(null, "TAX", null, null, false, 10, 2)).get(0);

        assertEquals(2, match.lines().size());
        assertEquals(2, match.matchCount());
    }

    @Test
    void fetchByQualifiedName() throws SQLException {
        jdbc.on("WHERE name =",
                source("APP", "PKG_A", "PACKAGE BODY", 1, "PACKAGE BODY pkg_a AS"),
                source("APP", "PKG_A", "PACKAGE", 1, "PACKAGE pkg_a AS"));

        List<ProcedureMatch> matches = new ProcedureSourceSearcher().fetchByName(jdbc.connection(),
                " app.pkg_a ", "IGNORED", List.of(), 0);

        assertEquals(List.of(ObjectType.PACKAGE, ObjectType.PACKAGE_BODY),
                matches.stream().map(ProcedureMatch::type).toList());
        assertEquals(0, matches.get(0).matchCount());
        assertTrue(matches.get(0).matchingLineNumbers().isEmpty());

        List<Object> binds = new ArrayList<>(ALL_TYPES);
        binds.add(0, "PKG_A");
        binds.add("APP");
        assertEquals(binds, jdbc.lastExecuted().binds());
    }

    @Test
    void fetchByBareNameUsesSchemaOption() throws SQLException {
        new ProcedureSourceSearcher().fetchByName(jdbc.connection(), "pkg_a", null, List.of(ObjectType.PACKAGE), 0);

        assertEquals(List.of("PKG_A", "PACKAGE"), jdbc.lastExecuted().binds());
        assertFalse(jdbc.lastExecuted().sql().contains("owner ="));
    }

    @Test
    void listenerSeesEachStatementWithItsBinds() throws SQLException {
        List<String> rendered = new ArrayList<>();
        jdbc.on(MATCH_PASS, source("APP", "PRC", "PROCEDURE", 1, "it's dim_customer"));

        new ProcedureSourceSearcher((sql, binds) -> rendered.add(sql.executable(binds)))
                .search(jdbc.connection(), query("DIM_CUSTOMER", null));

        assertEquals(2, rendered.size());
        assertTrue(rendered.get(0).contains("LIKE '%' || 'DIM_CUSTOMER' || '%'"));
        assertTrue(rendered.get(0).contains("'PACKAGE BODY'"));
        assertTrue(rendered.get(1).contains("('APP', 'PRC', 'PROCEDURE')"));
    }
}
