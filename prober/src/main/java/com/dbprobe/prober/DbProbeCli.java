package com.dbprobe.prober;

import com.dbprobe.prober.cli.CheckTableCommand;
import com.dbprobe.prober.cli.ConnectionsCommand;
import com.dbprobe.prober.cli.ExplainCommand;
import com.dbprobe.prober.cli.RunQueryCommand;
import com.dbprobe.prober.cli.SearchProceduresCommand;
import com.dbprobe.prober.cli.SearchSchemaCommand;
import com.dbprobe.prober.cli.VerifyConnectionsCommand;
import com.dbprobe.prober.connect.ConnectionVerifier;
import com.dbprobe.prober.connect.EnvConnectionProvider;
import com.dbprobe.prober.ops.CatalogOperations;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.time.Duration;

@Command(
        name = "dbprobe",
        description = "Inspect catalogs and run read-only queries on Oracle, MySQL, PostgreSQL and SQL Server",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                CheckTableCommand.class,
                SearchSchemaCommand.class,
                SearchProceduresCommand.class,
                RunQueryCommand.class,
                ExplainCommand.class,
                VerifyConnectionsCommand.class,
                ConnectionsCommand.class
        }
)
public class DbProbeCli implements Runnable {

    private final EnvConnectionProvider connections;
    private final CatalogOperations operations;
    private final Duration verifyTimeout;

    @Spec
    private CommandSpec spec;

    public DbProbeCli() {
        this(EnvConnectionProvider.fromSystem(), new CatalogOperations(), ConnectionVerifier.DEFAULT_TIMEOUT);
    }

    public DbProbeCli(EnvConnectionProvider connections, CatalogOperations operations, Duration verifyTimeout) {
        this.connections = connections;
        this.operations = operations;
        this.verifyTimeout = verifyTimeout;
    }

    public EnvConnectionProvider connections() {
        return connections;
    }

    public CatalogOperations operations() {
        return operations;
    }

    public ConnectionVerifier verifier() {
        return new ConnectionVerifier(connections, verifyTimeout);
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine commandLine(DbProbeCli cli) {
        return new CommandLine(cli).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine(new DbProbeCli()).execute(args);
        System.exit(exitCode);
    }
}
