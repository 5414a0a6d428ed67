package com.dbprobe.prober.format;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.Column;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.Partition;
import com.dbprobe.core.catalog.PlanIssue;
import com.dbprobe.core.catalog.PlanSeverity;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.SourceLine;
import com.dbprobe.core.catalog.Statistics;
import com.dbprobe.core.catalog.TableInfo;
import com.dbprobe.core.catalog.ObjectType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextFormatterTest {

    private final TextFormatter formatter = new TextFormatter();

    @Test
    void onlyTheFirstTenPartitionsAreListed() {
        List<Partition> partitions = new ArrayList<>();
        for (int i = 1; i <= 13; i++) {
            partitions.add(new Partition("P_" + i, i, null, (long) i * 10, null));
        }
        TableInfo info = new TableInfo("SALES", "ORDERS", DialectKind.ORACLE, "Orders",
                List.of(new Column("ID", "NUMBER(18)", false, null, "Key")), List.of(), partitions,
                new Statistics(130L, 5L, 40L, null));

        String text = formatter.tableInfo(info);

        assertTrue(text.contains("TABLE SALES.ORDERS  (oracle)"));
        assertTrue(text.contains("Comment: Orders"));
        assertTrue(text.contains("P_10"));
        assertFalse(text.contains("P_11"));
        assertTrue(text.contains("... and 3 more partitions"));
        assertTrue(text.contains("Never analyzed"));
        assertTrue(text.contains("No indexes."));
    }

    @Test
    void missingTableShowsEmptySections() {
        TableInfo info = new TableInfo("SALES", "NOPE", DialectKind.MYSQL, null,
                List.of(), List.of(), List.of(), Statistics.empty());

        String text = formatter.tableInfo(info);

        assertTrue(text.contains("Columns: 0"));
        assertTrue(text.contains("Table is not partitioned."));
        assertTrue(text.contains("No statistics."));
    }

    @Test
    void tableCommentHeadsEachTableGroup() {
        List<ColumnMatch> matches = List.of(
                new ColumnMatch("SALES", "DIM_CUST", "Customers", "ID", "NUMBER", false, ""),
                new ColumnMatch("SALES", "DIM_CUST", "Customers", "NAME", "VARCHAR2(100)", true, "Full name"),
                new ColumnMatch("SALES", "FACT_SALE", "", "CUST_ID", "NUMBER", true, ""));

        String text = formatter.columnMatches(matches);

        assertTrue(text.startsWith("Found 3 matches:"));
        assertEquals(1, text.split("-- SALES.DIM_CUST: Customers", -1).length - 1);
        assertFalse(text.contains("-- SALES.FACT_SALE"));
    }

    @Test
    void noMatchesHasAMessage() {
        assertEquals("No matches found.", formatter.columnMatches(List.of()));
        assertEquals("No matching procedure or package found.", formatter.procedureMatches(List.of()));
    }

    @Test
    void nullCellsPrintAsNull() {
        QueryResult result = new QueryResult(List.of("ID", "NOTE"),
                List.of(Arrays.asList(1, null), Arrays.asList(2, "ok")), 2, 3.5, true, 2);

        String text = formatter.queryResult(result);

        assertTrue(text.contains("1  | NULL"));
        assertTrue(text.contains("(2 rows, 3.5 ms)"));
        assertTrue(text.contains("Result truncated at 2 rows."));
    }

    @Test
    void procedureSourceFollowsItsHeader() {
        ProcedureMatch match = new ProcedureMatch("APP", "PKG_LOAD", ObjectType.PACKAGE_BODY, 2, List.of(3, 5),
                List.of(new SourceLine(1, "PACKAGE BODY pkg_load AS"), new SourceLine(2, "END;")));

        String text = formatter.procedureMatches(List.of(match));

        assertTrue(text.contains("  [PACKAGE BODY] APP.PKG_LOAD  (2 lines reference search term)\nPACKAGE BODY pkg_load AS\nEND;"));
    }

    @Test
    void planIssuesFollowThePlan() {
        ExecutionPlan plan = new ExecutionPlan(DialectKind.ORACLE, "SELECT * FROM t",
                List.of("| 1 | TABLE ACCESS FULL | T |"),
                List.of(new PlanIssue("FULL_TABLE_SCAN", PlanSeverity.WARNING, "Full table scan on T")));

        String text = formatter.executionPlan(plan);

        assertTrue(text.startsWith("| 1 | TABLE ACCESS FULL | T |"));
        assertTrue(text.contains("[WARNING] FULL_TABLE_SCAN: Full table scan on T"));
    }
}
