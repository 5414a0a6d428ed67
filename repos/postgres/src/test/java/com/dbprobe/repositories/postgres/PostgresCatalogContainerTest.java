package com.dbprobe.repositories.postgres;

import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.SearchField;
import com.dbprobe.core.catalog.TableInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers
@EnabledIfEnvironmentVariable(named = "TESTCONTAINERS", matches = "1")
class PostgresCatalogContainerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("dwh")
            .withUsername("test")
            .withPassword("test");

    private Connection connect() throws Exception {
        return DriverManager.getConnection(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    }

    @Test
    void inspectsAndSearchesARealCatalog() throws Exception {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE SCHEMA IF NOT EXISTS sales");
            stmt.execute("""
                    CREATE TABLE IF NOT EXISTS sales.orders (
                        order_id bigint PRIMARY KEY,
                        customer_id bigint NOT NULL,
                        status varchar(20) DEFAULT 'NEW',
                        amount numeric(12,2)
                    )""");
            stmt.execute("CREATE INDEX IF NOT EXISTS ix_orders_cust ON sales.orders (status, customer_id)");
            stmt.execute("COMMENT ON TABLE sales.orders IS 'Customer orders'");
            stmt.execute("COMMENT ON COLUMN sales.orders.amount IS 'Order total | VAT included'");
        }

        PostgresCatalogDialect dialect = new PostgresCatalogDialect();
        try (Connection conn = connect()) {
            TableInfo info = dialect.inspect(conn, "sales", "orders");

            assertEquals("Customer orders", info.tableComment());
            assertEquals(List.of("order_id", "customer_id", "status", "amount"),
                    info.columns().stream().map(c -> c.name()).toList());
            assertEquals("character varying(20)", info.columns().get(2).dataType());
            assertEquals("numeric(12,2)", info.columns().get(3).dataType());
            assertFalse(info.columns().get(1).nullable());
            assertTrue(info.columns().get(2).defaultValue().contains("NEW"));
            assertEquals("status, customer_id", info.indexes().stream()
                    .filter(i -> i.name().equals("ix_orders_cust")).findFirst().orElseThrow().columns());
            assertTrue(info.partitions().isEmpty());

            TableInfo missing = dialect.inspect(conn, "sales", "no_such_table");
            assertTrue(missing.columns().isEmpty());
            assertTrue(missing.statistics().isEmpty());

            List<ColumnMatch> matches = dialect.search(conn,
                    new MetadataQuery("vat", null, EnumSet.of(SearchField.COMMENTS), false, 10));
            assertEquals(1, matches.size());
            assertEquals("amount", matches.get(0).column());
        }
    }
}
