package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.SafetyViolationException;
import com.dbprobe.core.sql.QuerySafetyGuard;
import com.dbprobe.prober.format.ResultFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.sql.Connection;
import java.sql.SQLException;

@Command(
        name = "run-query",
        description = "Run a read-only SELECT, WITH or EXPLAIN statement with a row cap",
        mixinStandardHelpOptions = true
)
public class RunQueryCommand extends AbstractDbCommand {

    @Parameters(index = "0", description = "SQL statement")
    private String sql;

    @Option(names = {"--db"}, defaultValue = "DWH", description = "Database alias (default: ${DEFAULT-VALUE})")
    private String db;

    @Option(names = {"--max-rows"}, defaultValue = "100", description = "Row cap (default: ${DEFAULT-VALUE})")
    private int maxRows;

    @Override
    protected String alias() {
        return db;
    }

    @Override
    protected void precheck(DialectKind dialect) {
        if (!QuerySafetyGuard.isReadOnly(sql)) {
            throw new SafetyViolationException(sql);
        }
    }

    @Override
    protected String execute(DialectKind dialect, Connection conn, ResultFormatter formatter) throws SQLException {
        return formatter.queryResult(parent.operations().runGuardedQuery(dialect, conn, sql, maxRows));
    }
}
