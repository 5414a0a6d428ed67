package com.dbprobe.prober.connect;

import com.dbprobe.core.ConfigurationException;
import com.dbprobe.core.ConnectionProvider;
import com.dbprobe.core.DialectKind;
import com.dbprobe.core.DialectResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Connection settings read from environment variables, one group per alias:
 * {@code <A>_TYPE}, {@code <A>_URL}, {@code <A>_DSN}, {@code <A>_HOST}, {@code <A>_PORT},
 * {@code <A>_DATABASE}, {@code <A>_USERNAME} and {@code <A>_PASSWORD}.
 * <p>
 * A full JDBC URL wins over everything else. Oracle aliases may give a DSN instead of
 * host and port, either {@code host:port/service} or a TNS descriptor.
 */
public class EnvConnectionProvider implements ConnectionProvider {
    private static final Logger logger = LoggerFactory.getLogger(EnvConnectionProvider.class);

    private static final List<String> ALIAS_SUFFIXES = List.of("_TYPE", "_HOST", "_DSN", "_URL");

    private final Map<String, String> env;
    private final DialectResolver resolver;

    public EnvConnectionProvider(Map<String, String> env) {
        this.env = Map.copyOf(env);
        this.resolver = new DialectResolver(this::get);
    }

    public static EnvConnectionProvider fromSystem() {
        return new EnvConnectionProvider(System.getenv());
    }

    @Override
    public DialectKind resolveDialect(String alias) {
        return resolver.resolve(alias);
    }

    public ConnectionSettings settings(String alias) {
        String prefix = alias.trim().toUpperCase(Locale.ROOT);
        DialectKind dialect = resolveDialect(prefix);
        String username = get(prefix + "_USERNAME");
        String password = get(prefix + "_PASSWORD");

        String url = get(prefix + "_URL");
        if (url == null) {
            url = buildUrl(prefix, dialect);
        }
        return new ConnectionSettings(prefix, dialect, url, username, password);
    }

    @Override
    public Connection open(String alias) throws SQLException {
        ConnectionSettings settings = settings(alias);
        logger.info("Opening {} connection for {}", settings.dialect(), settings.alias());
        if (settings.username() != null) {
            return DriverManager.getConnection(settings.url(), settings.username(), settings.password());
        }
        return DriverManager.getConnection(settings.url());
    }

    /**
     * Aliases that have a connection variable and a resolvable type, sorted by name.
     * Aliases whose type is missing or unsupported are skipped with a warning.
     */
    public List<ConfiguredAlias> listAvailable() {
        TreeSet<String> aliases = new TreeSet<>();
        for (String key : env.keySet()) {
            for (String suffix : ALIAS_SUFFIXES) {
                if (key.endsWith(suffix) && key.length() > suffix.length()) {
                    aliases.add(key.substring(0, key.length() - suffix.length()));
                }
            }
        }

        List<ConfiguredAlias> available = new ArrayList<>();
        for (String alias : aliases) {
            try {
                available.add(new ConfiguredAlias(alias, resolveDialect(alias)));
            } catch (ConfigurationException e) {
                logger.warn("Skipping alias {}: {}", alias, e.getMessage());
            }
        }
        return available;
    }

    private String buildUrl(String prefix, DialectKind dialect) {
        String database = get(prefix + "_DATABASE");
        if (dialect == DialectKind.ORACLE) {
            String dsn = get(prefix + "_DSN");
            if (dsn != null) {
                return dsn.startsWith("(") ? "jdbc:oracle:thin:@" + dsn : "jdbc:oracle:thin:@//" + dsn;
            }
        }

        String host = require(prefix + "_HOST", dialect == DialectKind.ORACLE
                ? prefix + "_URL, " + prefix + "_DSN or " + prefix + "_HOST must be set"
                : prefix + "_URL or " + prefix + "_HOST must be set");
        String port = get(prefix + "_PORT");
        if (port == null) {
            port = String.valueOf(defaultPort(dialect));
        }

        return switch (dialect) {
            case ORACLE -> "jdbc:oracle:thin:@//" + host + ":" + port + "/"
                    + require(prefix + "_DATABASE", prefix + "_DATABASE (service name) must be set");
            case MYSQL -> "jdbc:mysql://" + host + ":" + port + "/" + (database == null ? "" : database);
            case POSTGRESQL -> "jdbc:postgresql://" + host + ":" + port + "/" + (database == null ? "" : database);
            case SQLSERVER -> "jdbc:sqlserver://" + host + ":" + port
                    + (database == null ? "" : ";databaseName=" + database)
                    + ";trustServerCertificate=true";
        };
    }

    static int defaultPort(DialectKind dialect) {
        return switch (dialect) {
            case ORACLE -> 1521;
            case MYSQL -> 3306;
            case POSTGRESQL -> 5432;
            case SQLSERVER -> 1433;
        };
    }

    private String require(String key, String message) {
        String value = get(key);
        if (value == null) {
            throw new ConfigurationException(message);
        }
        return value;
    }

    private String get(String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }
}
