package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.SafetyViolationException;
import com.dbprobe.core.sql.QuerySafetyGuard;
import com.dbprobe.prober.format.ResultFormatter;
import com.dbprobe.prober.ops.Dialects;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.sql.Connection;
import java.sql.SQLException;

@Command(
        name = "explain",
        description = "Show the execution plan of a read-only statement",
        mixinStandardHelpOptions = true
)
public class ExplainCommand extends AbstractDbCommand {

    @Parameters(index = "0", description = "SQL statement")
    private String sql;

    @Option(names = {"--db"}, defaultValue = "DWH", description = "Database alias (default: ${DEFAULT-VALUE})")
    private String db;

    @Override
    protected String alias() {
        return db;
    }

    /**
     * Fails on unsafe statements and on engines without plan support before connecting.
     */
    @Override
    protected void precheck(DialectKind dialect) {
        if (!QuerySafetyGuard.isReadOnly(sql)) {
            throw new SafetyViolationException(sql);
        }
        Dialects.of(dialect).explain(QuerySafetyGuard.normalize(sql));
    }

    @Override
    protected String execute(DialectKind dialect, Connection conn, ResultFormatter formatter) throws SQLException {
        return formatter.executionPlan(parent.operations().explain(dialect, conn, sql));
    }
}
