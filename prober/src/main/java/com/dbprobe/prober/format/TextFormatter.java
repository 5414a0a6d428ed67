package com.dbprobe.prober.format;

import com.dbprobe.core.catalog.Column;
import com.dbprobe.core.catalog.ColumnMatch;
import com.dbprobe.core.catalog.ExecutionPlan;
import com.dbprobe.core.catalog.Index;
import com.dbprobe.core.catalog.Partition;
import com.dbprobe.core.catalog.PlanIssue;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.QueryResult;
import com.dbprobe.core.catalog.SourceLine;
import com.dbprobe.core.catalog.Statistics;
import com.dbprobe.core.catalog.TableInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Plain aligned-column output for terminals.
 */
public class TextFormatter implements ResultFormatter {
    static final int PARTITIONS_SHOWN = 10;

    private static final String RULE = "=".repeat(80);

    @Override
    public String tableInfo(TableInfo info) {
        List<String> out = new ArrayList<>();
        out.add(RULE);
        out.add("TABLE " + info.schema() + "." + info.table() + "  (" + info.dialect() + ")");
        out.add(RULE);
        if (!info.tableComment().isEmpty()) {
            out.add("Comment: " + info.tableComment());
        }

        out.add("");
        out.add("Columns: " + info.columns().size());
        out.add("");
        out.add(String.format("%-5s %-35s %-25s %-6s %s", "#", "COLUMN", "TYPE", "NULL?", "COMMENT"));
        out.add("-".repeat(120));
        int position = 1;
        for (Column column : info.columns()) {
            out.add(String.format("%-5d %-35s %-25s %-6s %s", position++, column.name(), column.dataType(),
                    column.nullable() ? "Y" : "N", column.comment()));
        }

        out.add("");
        out.add(RULE);
        out.add("INDEXES");
        out.add(RULE);
        if (info.indexes().isEmpty()) {
            out.add("No indexes.");
        }
        for (Index index : info.indexes()) {
            out.add("  Index: " + index.name());
            out.add("  Type: " + index.type() + "  |  Unique: " + index.unique());
            out.add("  Columns: " + index.columns());
            out.add("");
        }

        out.add(RULE);
        out.add("PARTITIONS");
        out.add(RULE);
        if (info.partitions().isEmpty()) {
            out.add("Table is not partitioned.");
        } else {
            out.add("Partitions: " + info.partitions().size());
            out.add("");
            out.add(String.format("%-30s %-5s %-15s %s", "PARTITION", "POS", "NUM_ROWS", "COMPRESSION"));
            out.add("-".repeat(60));
            for (Partition partition : info.partitions().subList(0, Math.min(PARTITIONS_SHOWN, info.partitions().size()))) {
                out.add(String.format("%-30s %-5d %-15s %s", partition.name(), partition.position(),
                        orNa(partition.numRows()), orNa(partition.compression())));
            }
            if (info.partitions().size() > PARTITIONS_SHOWN) {
                out.add("... and " + (info.partitions().size() - PARTITIONS_SHOWN) + " more partitions");
            }
        }

        out.add("");
        out.add(RULE);
        out.add("STATISTICS");
        out.add(RULE);
        Statistics stats = info.statistics();
        if (stats.isEmpty()) {
            out.add("No statistics.");
        } else {
            out.add("Rows: " + orNa(stats.numRows()));
            out.add("Blocks: " + orNa(stats.blocks()));
            out.add("Avg row length: " + orNa(stats.avgRowLen()));
            out.add(stats.lastAnalyzed() == null ? "Never analyzed" : "Last analyzed: " + stats.lastAnalyzed());
        }
        return String.join("\n", out);
    }

    @Override
    public String columnMatches(List<ColumnMatch> matches) {
        if (matches.isEmpty()) {
            return "No matches found.";
        }
        List<String> out = new ArrayList<>();
        out.add("Found " + matches.size() + " matches:");
        out.add("");
        out.add(String.format("%-20s %-35s %-35s %-20s %s", "SCHEMA", "TABLE", "COLUMN", "TYPE", "COLUMN COMMENT"));
        out.add("-".repeat(150));

        String currentTable = null;
        for (ColumnMatch match : matches) {
            String tableKey = match.schema() + "." + match.table();
            if (!tableKey.equals(currentTable)) {
                currentTable = tableKey;
                if (!match.tableComment().isEmpty()) {
                    out.add("");
                    out.add("-- " + tableKey + ": " + match.tableComment());
                }
            }
            out.add(String.format("%-20s %-35s %-35s %-20s %s", match.schema(), match.table(), match.column(),
                    match.dataType(), match.columnComment()));
        }
        return String.join("\n", out);
    }

    @Override
    public String procedureMatches(List<ProcedureMatch> matches) {
        if (matches.isEmpty()) {
            return "No matching procedure or package found.";
        }
        List<String> out = new ArrayList<>();
        out.add("Found " + matches.size() + " object(s) (full source below):");
        out.add("");
        for (ProcedureMatch match : matches) {
            String header = "  [" + match.type() + "] " + match.schema() + "." + match.name();
            if (match.matchCount() > 0) {
                header += "  (" + match.matchCount() + " lines reference search term)";
            }
            out.add(header);
            for (SourceLine line : match.lines()) {
                out.add(line.text());
            }
            out.add("");
        }
        return String.join("\n", out);
    }

    @Override
    public String queryResult(QueryResult result) {
        List<String> out = new ArrayList<>();
        int[] widths = new int[result.columns().size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = result.columns().get(i).length();
        }
        for (List<Object> row : result.rows()) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], cell(row.get(i)).length());
            }
        }

        out.add(line(result.columns(), widths));
        StringJoiner rule = new StringJoiner("-+-");
        for (int width : widths) {
            rule.add("-".repeat(width));
        }
        out.add(rule.toString());
        for (List<Object> row : result.rows()) {
            out.add(line(row, widths));
        }

        out.add("");
        out.add("(" + result.rowCount() + " rows, " + result.executionTimeMs() + " ms)");
        if (result.truncated()) {
            out.add("Result truncated at " + result.rowLimit() + " rows.");
        }
        return String.join("\n", out);
    }

    @Override
    public String executionPlan(ExecutionPlan plan) {
        List<String> out = new ArrayList<>(plan.lines());
        if (!plan.issues().isEmpty()) {
            out.add("");
            out.add("Plan analysis:");
            for (PlanIssue issue : plan.issues()) {
                out.add("  [" + issue.severity() + "] " + issue.type() + ": " + issue.message());
            }
        }
        return String.join("\n", out);
    }

    private static String line(List<?> cells, int[] widths) {
        StringJoiner joiner = new StringJoiner(" | ");
        for (int i = 0; i < widths.length; i++) {
            joiner.add(pad(cell(cells.get(i)), widths[i]));
        }
        return joiner.toString().stripTrailing();
    }

    private static String pad(String text, int width) {
        return text + " ".repeat(width - text.length());
    }

    private static String cell(Object value) {
        return value == null ? "NULL" : value.toString();
    }

    private static String orNa(Object value) {
        return value == null ? "N/A" : value.toString();
    }
}
