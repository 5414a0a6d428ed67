package com.dbprobe.prober.cli;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.MetadataQuery;
import com.dbprobe.core.catalog.SearchField;
import com.dbprobe.prober.format.ResultFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.sql.Connection;
import java.sql.SQLException;

@Command(
        name = "search-schema",
        description = "Search table and column names and comments",
        mixinStandardHelpOptions = true
)
public class SearchSchemaCommand extends AbstractDbCommand {

    @Option(names = {"--keyword", "-k"}, required = true, description = "Keyword or regular expression")
    private String keyword;

    @Option(names = {"--db"}, defaultValue = "DWH", description = "Database alias (default: ${DEFAULT-VALUE})")
    private String db;

    @Option(names = {"--schema", "-s"}, description = "Restrict to one schema or owner")
    private String schema;

    @Option(names = {"--search-in"}, defaultValue = "names,comments",
            description = "Comma separated: names, comments (default: ${DEFAULT-VALUE})")
    private String searchIn;

    @Option(names = {"--regex"}, negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Treat the keyword as a regular expression (default: on)")
    private boolean regex;

    @Option(names = {"--limit"}, defaultValue = "200", description = "Maximum matches (default: ${DEFAULT-VALUE})")
    private int limit;

    @Override
    protected String alias() {
        return db;
    }

    @Override
    protected String execute(DialectKind dialect, Connection conn, ResultFormatter formatter) throws SQLException {
        MetadataQuery query = new MetadataQuery(keyword, schema, SearchField.parse(searchIn), regex, limit);
        return formatter.columnMatches(parent.operations().searchMetadata(dialect, conn, query));
    }
}
