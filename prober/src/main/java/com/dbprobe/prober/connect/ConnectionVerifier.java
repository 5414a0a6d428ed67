package com.dbprobe.prober.connect;

import com.dbprobe.core.ConnectionProvider;
import com.dbprobe.core.DialectKind;
import com.dbprobe.prober.ops.Dialects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens each alias and runs its dialect's ping statement, giving up on an alias after a
 * wall-clock timeout. Attempts run one at a time on daemon threads, so a driver stuck in
 * a connect call does not keep the JVM alive.
 */
public class ConnectionVerifier {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionVerifier.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final ConnectionProvider connections;
    private final Duration timeout;

    public ConnectionVerifier(ConnectionProvider connections) {
        this(connections, DEFAULT_TIMEOUT);
    }

    public ConnectionVerifier(ConnectionProvider connections, Duration timeout) {
        this.connections = connections;
        this.timeout = timeout;
    }

    public List<VerificationResult> verify(List<ConfiguredAlias> aliases) {
        ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "dbprobe-verify");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<VerificationResult> results = new ArrayList<>();
            for (ConfiguredAlias alias : aliases) {
                results.add(verifyOne(executor, alias));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private VerificationResult verifyOne(ExecutorService executor, ConfiguredAlias alias) {
        logger.debug("Verifying {} ({})", alias.alias(), alias.dialect());
        Future<?> attempt = executor.submit(() -> {
            ping(alias.alias(), alias.dialect());
            return null;
        });
        try {
            attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return new VerificationResult(alias.alias(), alias.dialect(), null);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            logger.warn("Connection check for {} timed out", alias.alias());
            return new VerificationResult(alias.alias(), alias.dialect(), "timeout (" + timeout.toSeconds() + "s)");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.debug("Connection check for {} failed", alias.alias(), cause);
            return new VerificationResult(alias.alias(), alias.dialect(), String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.cancel(true);
            return new VerificationResult(alias.alias(), alias.dialect(), "interrupted");
        }
    }

    private void ping(String alias, DialectKind dialect) throws SQLException {
        String sql = Dialects.of(dialect).pingSql();
        try (Connection conn = connections.open(alias);
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
        }
    }
}
