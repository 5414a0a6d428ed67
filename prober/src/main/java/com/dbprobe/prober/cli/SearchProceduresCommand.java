package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.DialectUnsupportedException;
import com.dbprobe.core.catalog.ObjectType;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.ProcedureQuery;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.core.sql.ParamStyle;
import com.dbprobe.prober.format.ResultFormatter;
import com.dbprobe.repositories.rdbms.StatementListener;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Command(
        name = "search-procedures",
        description = "Search Oracle procedure, package and function source by table name or text",
        mixinStandardHelpOptions = true
)
public class SearchProceduresCommand extends AbstractDbCommand {

    @Option(names = {"--table", "-t"}, description = "Table name to look for in source lines")
    private String table;

    @Option(names = {"--text", "-e"}, description = "Any text to look for in source lines")
    private String text;

    @Option(names = {"--name", "-n"}, description = "Fetch by object name, NAME or OWNER.NAME")
    private String name;

    @Option(names = {"--db"}, defaultValue = "DWH_ADMIN", description = "Database alias (default: ${DEFAULT-VALUE})")
    private String db;

    @Option(names = {"--schema", "-s"}, description = "Restrict to one owner")
    private String schema;

    @Option(names = {"--type"}, defaultValue = "PROCEDURE,PACKAGE,PACKAGE BODY,FUNCTION",
            description = "Comma separated object types (default: ${DEFAULT-VALUE})")
    private String types;

    @Option(names = {"--regex"}, description = "Treat --table and --text as regular expressions")
    private boolean regex;

    @Option(names = {"--limit"}, defaultValue = "100", description = "Maximum objects (default: ${DEFAULT-VALUE})")
    private int limit;

    @Option(names = {"--limit-lines"}, defaultValue = "0",
            description = "Maximum source lines per object, 0 for all (default: ${DEFAULT-VALUE})")
    private int limitLines;

    @Option(names = {"--show-query"}, description = "Print each statement and its binds to stderr")
    private boolean showQuery;

    @Override
    public Integer call() {
        if (isBlank(table) && isBlank(text) && isBlank(name)) {
            throw new ParameterException(spec.commandLine(), "Need at least one of --table, --text or --name");
        }
        return super.call();
    }

    @Override
    protected String alias() {
        return db;
    }

    @Override
    protected void precheck(DialectKind dialect) {
        if (dialect != DialectKind.ORACLE) {
            throw new DialectUnsupportedException(dialect, "search-procedures");
        }
    }

    @Override
    protected String execute(DialectKind dialect, Connection conn, ResultFormatter formatter) throws SQLException {
        StatementListener listener = showQuery ? this::printStatement : StatementListener.NONE;
        List<ObjectType> objectTypes = parseTypes(types);
        List<ProcedureMatch> matches = isBlank(name)
                ? parent.operations().searchProcedures(dialect, conn,
                        new ProcedureQuery(table, text, schema, objectTypes, regex, limit, limitLines), listener)
                : parent.operations().fetchProcedure(dialect, conn, name, schema, objectTypes, limitLines, listener);
        return formatter.procedureMatches(matches);
    }

    /**
     * Unknown type names are ignored; an empty result selects every type.
     */
    static List<ObjectType> parseTypes(String csv) {
        List<ObjectType> parsed = new ArrayList<>();
        for (String part : csv.split(",")) {
            ObjectType.fromCatalogName(part).ifPresent(type -> {
                if (!parsed.contains(type)) {
                    parsed.add(type);
                }
            });
        }
        return parsed;
    }

    private void printStatement(NamedSql sql, Map<String, ?> binds) {
        ParamStyle style = ParamStyle.of(DialectKind.ORACLE);
        err().println("-- Query (" + style.placeholder() + " binds)");
        err().println(sql.render(style).strip());
        err().println("-- Binds: " + binds);
        err().println("-- Executable query (copy-paste to run)");
        err().println(sql.executable(binds).strip());
        err().println();
        err().flush();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
