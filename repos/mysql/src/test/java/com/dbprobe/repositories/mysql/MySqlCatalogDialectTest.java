package com.dbprobe.repositories.mysql;

import com.dbprobe.core.catalog.TableInfo;
import com.dbprobe.repos.certification.CatalogDialectCertification;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.dbprobe.repos.certification.ScriptedJdbc.row;
import static org.junit.jupiter.api.Assertions.*;

class MySqlCatalogDialectTest extends CatalogDialectCertification {

    @Override
    public void init() {
        dialect = new MySqlCatalogDialect();
    }

    @Override
    public String columnsFragment() {
        return "FROM information_schema.columns WHERE";
    }

    @Override
    public String indexColumnsFragment() {
        return "FROM information_schema.statistics";
    }

    @Override
    public String searchFragment() {
        return "FROM information_schema.columns c";
    }

    @Override
    public Map<String, Object> varcharCells() {
        return row("data_type", "varchar(30)", "is_nullable", "YES");
    }

    @Override
    public String expectedVarcharType() {
        return "varchar(30)";
    }

    @Test
    void partitionsAndStatisticsComeFromInformationSchema() throws SQLException {
        jdbc.on("FROM information_schema.partitions",
                        row("partition_name", "p2023", "partition_position", BigInteger.ONE,
                                "high_value", "2024", "num_rows", BigInteger.valueOf(500), "compression", "RANGE"))
                .on("avg_row_length",
                        row("num_rows", BigInteger.valueOf(500), "blocks", BigInteger.valueOf(16384),
                                "avg_row_len", BigInteger.valueOf(32),
                                "last_analyzed", LocalDateTime.of(2024, 3, 1, 8, 30)));

        TableInfo info = dialect.inspect(jdbc.connection(), "shop", "orders");

        assertEquals(1, info.partitions().size());
        assertEquals("RANGE", info.partitions().get(0).compression());
        assertEquals("2024", info.partitions().get(0).highValue());
        assertEquals(16384L, info.statistics().blocks());
        assertEquals("2024-03-01T08:30", info.statistics().lastAnalyzed());
    }

    @Test
    void explainPrefixesStatement() {
        assertEquals(List.of("EXPLAIN SELECT 1"), dialect.explain("SELECT 1"));
    }
}
