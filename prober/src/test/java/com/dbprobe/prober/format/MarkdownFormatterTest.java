package com.dbprobe.prober.format;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.Column;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.Index;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.Statistics;
import com.dbprobe.core.catalog.TableInfo;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownFormatterTest {

    private final MarkdownFormatter formatter = new MarkdownFormatter();

    @Test
    void pipesInCommentsAreEscaped() {
        String md = formatter.columnMatches(List.of(
                new ColumnMatch("S", "T", "", "C", "INT", true, "net | gross")));

        assertTrue(md.contains("| S | T | C | INT | net \\| gross |"));
    }

    @Test
    void tableInfoHasColumnAndIndexTables() {
        TableInfo info = new TableInfo("public", "orders", DialectKind.POSTGRESQL, "Orders\nof customers",
                List.of(new Column("id", "bigint", false, null, ""), new Column("status", "text", true, "'NEW'", "a|b")),
                List.of(new Index("orders_pkey", "btree", "UNIQUE", "id")),
                List.of(), Statistics.empty());

        String md = formatter.tableInfo(info);

        assertTrue(md.startsWith("# public.orders"));
        assertTrue(md.contains("> Orders of customers"));
        assertTrue(md.contains("| 2 | status | text | Y | 'NEW' | a\\|b |"));
        assertTrue(md.contains("| orders_pkey | btree | UNIQUE | id |"));
        assertFalse(md.contains("## Partitions"));
        assertTrue(md.contains("_No statistics._"));
    }

    @Test
    void queryCellsAreEscapedAndNullsShown() {
        String md = formatter.queryResult(new QueryResult(List.of("a", "b"),
                List.of(Arrays.asList("x|y", null)), 1, 1.25, false, 100));

        assertTrue(md.contains("| a | b |\n|---|---|\n| x\\|y | NULL |"));
        assertTrue(md.contains("_1 rows in 1.25 ms._"));
    }
}
