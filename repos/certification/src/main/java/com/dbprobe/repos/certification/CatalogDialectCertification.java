package com.dbprobe.repos.certification;

import com.dbprobe.core.CatalogDialect;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.SearchField;
import com.dbprobe.core.catalog.TableInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.dbprobe.repos.certification.ScriptedJdbc.row;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link CatalogDialect} must share, checked against a scripted connection.
 * Subclasses describe how their catalog statements can be recognised and what a
 * nullable character column looks like in their catalog rows.
 */
public abstract class CatalogDialectCertification {

    public CatalogDialect dialect;
    public ScriptedJdbc jdbc;

    public abstract void init();

    /**
     * Fragment identifying the statement that lists a table's columns.
     */
    public abstract String columnsFragment();

    public abstract String indexColumnsFragment();

    public abstract String searchFragment();

    /**
     * Type and nullability cells of a nullable character column of length 30.
     */
    public abstract Map<String, Object> varcharCells();

    /**
     * How the dialect spells the type described by {@link #varcharCells()}.
     */
    public abstract String expectedVarcharType();

    /**
     * The value bound for a search restricted to {@code schema}.
     */
    public String expectedSchemaBind(String schema) {
        return schema;
    }

    @BeforeEach
    public void setUp() {
        jdbc = new ScriptedJdbc();
        init();
    }

    @Test
    public void missingTableYieldsEmptyStructures() throws SQLException {
        TableInfo info = dialect.inspect(jdbc.connection(), "SALES", "NO_SUCH_TABLE");

        assertEquals(dialect.kind(), info.dialect());
        assertEquals("SALES", info.schema());
        assertEquals("NO_SUCH_TABLE", info.table());
        assertEquals("", info.tableComment());
        assertTrue(info.columns().isEmpty());
        assertTrue(info.indexes().isEmpty());
        assertTrue(info.partitions().isEmpty());
        assertTrue(info.statistics().isEmpty());
    }

    @Test
    public void catalogStatementsBindSchemaAndTable() throws SQLException {
        dialect.inspect(jdbc.connection(), "SALES", "ORDERS");

        assertFalse(jdbc.executed().isEmpty());
        for (ScriptedJdbc.Executed executed : jdbc.executed()) {
            assertFalse(executed.sql().contains("ORDERS"), executed.sql());
            assertTrue(executed.binds().contains("ORDERS"), executed.sql());
            assertTrue(executed.binds().contains("SALES"), executed.sql());
        }
    }

    @Test
    public void columnsKeepCatalogOrder() throws SQLException {
        jdbc.on(columnsFragment(),
                columnRow("ORDER_ID", "Order key", null),
                columnRow("NOTE", null, "'n/a'"));

        TableInfo info = dialect.inspect(jdbc.connection(), "SALES", "ORDERS");

        assertEquals(2, info.columns().size());
        assertEquals("ORDER_ID", info.columns().get(0).name());
        assertEquals("Order key", info.columns().get(0).comment());
        assertEquals(expectedVarcharType(), info.columns().get(0).dataType());
        assertTrue(info.columns().get(0).nullable());
        assertNull(info.columns().get(0).defaultValue());
        assertEquals("NOTE", info.columns().get(1).name());
        assertEquals("", info.columns().get(1).comment());
        assertEquals("'n/a'", info.columns().get(1).defaultValue());
    }

    @Test
    public void indexColumnsAreFoldedByKeyPosition() throws SQLException {
        jdbc.on(indexColumnsFragment(),
                indexRow("IDX1", "COL_B", 2),
                indexRow("PK_ORDERS", "ORDER_ID", 1),
                indexRow("IDX1", "COL_A", 1));

        TableInfo info = dialect.inspect(jdbc.connection(), "SALES", "ORDERS");

        assertEquals(2, info.indexes().size());
        assertEquals("IDX1", info.indexes().get(0).name());
        assertEquals("COL_A, COL_B", info.indexes().get(0).columns());
        assertEquals("ORDER_ID", info.indexes().get(1).columns());
    }

    @Test
    public void namesOnlySearchIgnoresComments() throws SQLException {
        jdbc.on(searchFragment(),
                searchRow("ORDERS", "", "AMOUNT", "customer paid amount"),
                searchRow("ORDERS", "", "CUSTOMER_ID", ""));

        List<ColumnMatch> matches = dialect.search(jdbc.connection(),
                new MetadataQuery("customer", null, EnumSet.of(SearchField.NAMES), false, 200));

        assertEquals(1, matches.size());
        assertEquals("CUSTOMER_ID", matches.get(0).column());
        assertEquals(expectedVarcharType(), matches.get(0).dataType());
        assertTrue(matches.get(0).nullable());
    }

    @Test
    public void commentSearchMatchesTableComments() throws SQLException {
        jdbc.on(searchFragment(),
                searchRow("DIM_CUST", "Khách hàng", "ID", ""),
                searchRow("DIM_CUST", "Khách hàng", "NAME", ""),
                searchRow("FACT_SALE", "", "CUST_ID", ""));

        List<ColumnMatch> matches = dialect.search(jdbc.connection(),
                new MetadataQuery("khách", null, EnumSet.of(SearchField.COMMENTS), true, 200));

        assertEquals(List.of("ID", "NAME"), matches.stream().map(ColumnMatch::column).toList());
        assertEquals("Khách hàng", matches.get(0).tableComment());
    }

    @Test
    public void searchStopsAtLimitInCatalogOrder() throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(searchRow("ORDERS", "", "AMOUNT_" + i, ""));
        }
        jdbc.on(searchFragment(), rows);

        List<ColumnMatch> matches = dialect.search(jdbc.connection(),
                new MetadataQuery("amount", null, Set.of(), true, 2));

        assertEquals(List.of("AMOUNT_1", "AMOUNT_2"), matches.stream().map(ColumnMatch::column).toList());
    }

    @Test
    public void schemaFilterIsBound() throws SQLException {
        dialect.search(jdbc.connection(), new MetadataQuery("x", "sales", Set.of(), false, 10));
        assertEquals(List.of(expectedSchemaBind("sales")), jdbc.lastExecuted().binds());

        dialect.search(jdbc.connection(), new MetadataQuery("x", null, Set.of(), false, 10));
        assertTrue(jdbc.lastExecuted().binds().isEmpty());
    }

    @Test
    public void pingAndPaginationAreDefined() {
        assertFalse(dialect.pingSql().isBlank());
        assertTrue(dialect.isReadOnly("SELECT * FROM orders"));
        assertFalse(dialect.isReadOnly("DELETE FROM orders"));
        String capped = dialect.cap("SELECT * FROM orders;", 42);
        assertEquals(capped.indexOf("42"), capped.lastIndexOf("42"));
        assertFalse(capped.contains(";"));
    }

    private Map<String, Object> columnRow(String name, String comment, String defaultValue) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("column_name", name);
        row.putAll(varcharCells());
        row.put("column_comment", comment);
        row.put("default_value", defaultValue);
        return row;
    }

    private static Map<String, Object> indexRow(String index, String column, int position) {
        return row("index_name", index, "index_type", "NORMAL", "uniqueness", "NONUNIQUE",
                "column_name", column, "column_position", position);
    }

    private Map<String, Object> searchRow(String table, String tableComment, String column, String columnComment) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("schema_name", "SALES");
        row.put("table_name", table);
        row.put("column_name", column);
        row.putAll(varcharCells());
        row.put("column_comment", columnComment);
        row.put("table_comment", tableComment);
        return row;
    }
}
