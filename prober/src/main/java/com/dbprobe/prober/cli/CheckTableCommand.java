package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.prober.format.ResultFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.sql.Connection;
import java.sql.SQLException;

@Command(
        name = "check-table",
        description = "Show columns, indexes, partitions and statistics of a table",
        mixinStandardHelpOptions = true
)
public class CheckTableCommand extends AbstractDbCommand {

    @Parameters(index = "0", description = "Schema or owner")
    private String schema;

    @Parameters(index = "1", description = "Table name")
    private String table;

    @Option(names = {"--db"}, defaultValue = "DWH", description = "Database alias (default: ${DEFAULT-VALUE})")
    private String db;

    @Override
    protected String alias() {
        return db;
    }

    @Override
    protected String execute(DialectKind dialect, Connection conn, ResultFormatter formatter) throws SQLException {
        return formatter.tableInfo(parent.operations().inspectTable(dialect, conn, schema, table));
    }
}
