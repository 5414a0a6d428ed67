package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repos.certification.ScriptedJdbc;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dbprobe.repos.certification.ScriptedJdbc.row;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NamedStatementsTest {

    private static final NamedSql BY_OWNER = NamedSql.parse(
            "SELECT table_name FROM all_tables WHERE owner = :schema AND table_name LIKE :pattern OR owner = :schema");

    @Test
    void bindsFollowMarkerOrder() throws SQLException {
        ScriptedJdbc jdbc = new ScriptedJdbc()
                .on("FROM all_tables", row("table_name", "ORDERS"), row("table_name", "ORDER_LINES"));

        List<String> names = NamedStatements.list(jdbc.connection(), BY_OWNER,
                Map.of("pattern", "ORD%", "schema", "SALES"), rs -> rs.getString("table_name"));

        assertEquals(List.of("ORDERS", "ORDER_LINES"), names);
        assertEquals("SELECT table_name FROM all_tables WHERE owner = ? AND table_name LIKE ? OR owner = ?",
                jdbc.lastExecuted().sql());
        assertEquals(List.of("SALES", "ORD%", "SALES"), jdbc.lastExecuted().binds());
    }

    @Test
    void firstIsEmptyWithoutRows() throws SQLException {
        ScriptedJdbc jdbc = new ScriptedJdbc();

        Optional<String> first = NamedStatements.first(jdbc.connection(), BY_OWNER,
                Map.of("pattern", "X", "schema", "S"), rs -> rs.getString("table_name"));

        assertTrue(first.isEmpty());
    }

    @Test
    void firstReadsOnlyTheFirstRow() throws SQLException {
        ScriptedJdbc jdbc = new ScriptedJdbc()
                .on("FROM all_tables", row("table_name", "A"), row("table_name", "B"));

        assertEquals(Optional.of("A"), NamedStatements.first(jdbc.connection(), BY_OWNER,
                Map.of("pattern", "%", "schema", "S"), rs -> rs.getString("table_name")));
    }

    @Test
    void missingBindClosesTheStatement() throws SQLException {
        Connection conn = mock(Connection.class);
        PreparedStatement stmt = mock(PreparedStatement.class);
        when(conn.prepareStatement(anyString())).thenReturn(stmt);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> NamedStatements.prepare(conn, BY_OWNER, Map.of("schema", "S")));

        assertTrue(e.getMessage().contains(":pattern"));
        verify(stmt).close();
    }
}
