package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.prober.DbProbeCli;
import com.dbprobe.prober.format.OutputFormat;
import com.dbprobe.prober.format.ResultFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * A command that works on one aliased database: resolve the dialect, open one connection,
 * run, print the rendered result. Failures print {@code Error: <message>} and exit with 1.
 */
abstract class AbstractDbCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractDbCommand.class);

    @ParentCommand
    protected DbProbeCli parent;

    @Spec
    protected CommandSpec spec;

    @Option(names = {"--format", "-f"}, defaultValue = "TEXT",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    protected OutputFormat format;

    protected abstract String alias();

    /**
     * Checks that need no connection. Runs before the connection is opened.
     */
    protected void precheck(DialectKind dialect) {
    }

    protected abstract String execute(DialectKind dialect, Connection conn, ResultFormatter formatter)
            throws SQLException;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    @Override
    public Integer call() {
        try {
            DialectKind dialect = parent.connections().resolveDialect(alias());
            precheck(dialect);
            String rendered;
            try (Connection conn = parent.connections().open(alias())) {
                rendered = execute(dialect, conn, format.formatter());
            }
            out().println(rendered);
            out().flush();
            return 0;
        } catch (Exception e) {
            err().println("Error: " + e.getMessage());
            err().flush();
            logger.debug("{} failed", spec.name(), e);
            return 1;
        }
    }
}
