package com.dbprobe.prober.connect;

import com.dbprobe.core.ConnectionProvider;
import com.dbprobe.core.DialectKind;
import com.dbprobe.repos.certification.ScriptedJdbc;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionVerifierTest {

    private final ScriptedJdbc jdbc = new ScriptedJdbc();

    private ConnectionProvider provider(String failingAlias, String hangingAlias) {
        return new ConnectionProvider() {
            @Override
            public DialectKind resolveDialect(String alias) {
                throw new UnsupportedOperationException();
            }

            @Override
            public Connection open(String alias) throws SQLException {
                if (alias.equals(failingAlias)) {
                    throw new SQLException("ORA-12541: TNS:no listener");
                }
                if (alias.equals(hangingAlias)) {
                    try {
                        Thread.sleep(30_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return jdbc.connection();
            }
        };
    }

    @Test
    void pingsEachAliasWithItsDialectStatement() {
        ConnectionVerifier verifier = new ConnectionVerifier(provider(null, null));

        List<VerificationResult> results = verifier.verify(List.of(
                new ConfiguredAlias("DWH", DialectKind.ORACLE),
                new ConfiguredAlias("SOURCE", DialectKind.MYSQL)));

        assertTrue(results.stream().allMatch(VerificationResult::ok));
        assertEquals("SELECT 1 FROM DUAL", jdbc.executed().get(0).sql());
        assertEquals("SELECT 1", jdbc.executed().get(1).sql());
    }

    @Test
    void driverErrorsAreReported() {
        ConnectionVerifier verifier = new ConnectionVerifier(provider("DWH", null));

        List<VerificationResult> results = verifier.verify(List.of(
                new ConfiguredAlias("DWH", DialectKind.ORACLE),
                new ConfiguredAlias("PG", DialectKind.POSTGRESQL)));

        assertFalse(results.get(0).ok());
        assertEquals("ORA-12541: TNS:no listener", results.get(0).error());
        assertTrue(results.get(1).ok());
    }

    @Test
    void slowConnectionsTimeOut() {
        ConnectionVerifier verifier = new ConnectionVerifier(provider(null, "SLOW"), Duration.ofSeconds(1));

        List<VerificationResult> results = verifier.verify(List.of(new ConfiguredAlias("SLOW", DialectKind.SQLSERVER)));

        assertEquals("timeout (1s)", results.get(0).error());
    }
}
