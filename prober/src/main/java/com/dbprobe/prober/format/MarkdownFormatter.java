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
 * GitHub-flavoured Markdown. Free text placed in table cells has {@code |} escaped and
 * line breaks flattened.
 */
public class MarkdownFormatter implements ResultFormatter {

    @Override
    public String tableInfo(TableInfo info) {
        List<String> out = new ArrayList<>();
        out.add("# " + info.schema() + "." + info.table());
        out.add("");
        if (!info.tableComment().isEmpty()) {
            out.add("> " + escape(info.tableComment()));
            out.add("");
        }
        out.add("**Database type:** " + info.dialect());
        out.add("");

        out.add("## Columns");
        out.add("");
        out.add("| # | Column | Type | Nullable | Default | Comment |");
        out.add("|---|--------|------|----------|---------|---------|");
        int position = 1;
        for (Column column : info.columns()) {
            out.add("| " + position++ + " | " + column.name() + " | " + column.dataType() + " | "
                    + (column.nullable() ? "Y" : "N") + " | "
                    + (column.defaultValue() == null ? "" : escape(column.defaultValue())) + " | "
                    + escape(column.comment()) + " |");
        }

        out.add("");
        out.add("## Indexes");
        out.add("");
        if (info.indexes().isEmpty()) {
            out.add("_No indexes._");
        } else {
            out.add("| Name | Type | Unique | Columns |");
            out.add("|------|------|--------|---------|");
            for (Index index : info.indexes()) {
                out.add("| " + index.name() + " | " + index.type() + " | " + index.unique() + " | "
                        + index.columns() + " |");
            }
        }

        if (!info.partitions().isEmpty()) {
            out.add("");
            out.add("## Partitions");
            out.add("");
            out.add("| Name | Position | High value | Rows | Compression |");
            out.add("|------|----------|------------|------|-------------|");
            for (Partition partition : info.partitions()) {
                out.add("| " + partition.name() + " | " + partition.position() + " | "
                        + escape(orEmpty(partition.highValue())) + " | " + orEmpty(partition.numRows()) + " | "
                        + orEmpty(partition.compression()) + " |");
            }
        }

        out.add("");
        out.add("## Statistics");
        out.add("");
        Statistics stats = info.statistics();
        if (stats.isEmpty()) {
            out.add("_No statistics._");
        } else {
            out.add("- **Rows:** " + orNa(stats.numRows()));
            out.add("- **Blocks:** " + orNa(stats.blocks()));
            out.add("- **Avg row length:** " + orNa(stats.avgRowLen()));
            out.add("- **Last analyzed:** " + orNa(stats.lastAnalyzed()));
        }
        return String.join("\n", out);
    }

    @Override
    public String columnMatches(List<ColumnMatch> matches) {
        if (matches.isEmpty()) {
            return "No matches found.";
        }
        List<String> out = new ArrayList<>();
        out.add("Found **" + matches.size() + "** matches:");
        out.add("");
        out.add("| Schema | Table | Column | Type | Column Comment |");
        out.add("|--------|-------|--------|------|----------------|");
        for (ColumnMatch match : matches) {
            out.add("| " + match.schema() + " | " + match.table() + " | " + match.column() + " | "
                    + match.dataType() + " | " + escape(match.columnComment()) + " |");
        }
        return String.join("\n", out);
    }

    @Override
    public String procedureMatches(List<ProcedureMatch> matches) {
        if (matches.isEmpty()) {
            return "No matching procedure or package found.";
        }
        List<String> out = new ArrayList<>();
        out.add("Found **" + matches.size() + "** matching objects (full source).");
        out.add("");
        for (ProcedureMatch match : matches) {
            String heading = "### `" + match.schema() + "." + match.name() + "` (" + match.type() + ")";
            if (match.matchCount() > 0) {
                heading += ": " + match.matchCount() + " lines reference search term";
            }
            out.add(heading);
            out.add("");
            out.add("```sql");
            for (SourceLine line : match.lines()) {
                out.add(line.text());
            }
            out.add("```");
            out.add("");
        }
        return String.join("\n", out);
    }

    @Override
    public String queryResult(QueryResult result) {
        List<String> out = new ArrayList<>();
        out.add(row(result.columns()));
        StringJoiner rule = new StringJoiner("|", "|", "|");
        for (int i = 0; i < result.columns().size(); i++) {
            rule.add("---");
        }
        out.add(rule.toString());
        for (List<Object> cells : result.rows()) {
            out.add(row(cells));
        }
        out.add("");
        String summary = "_" + result.rowCount() + " rows in " + result.executionTimeMs() + " ms";
        out.add(result.truncated() ? summary + ", truncated at " + result.rowLimit() + " rows._" : summary + "._");
        return String.join("\n", out);
    }

    @Override
    public String executionPlan(ExecutionPlan plan) {
        List<String> out = new ArrayList<>();
        out.add("```");
        out.addAll(plan.lines());
        out.add("```");
        if (!plan.issues().isEmpty()) {
            out.add("");
            for (PlanIssue issue : plan.issues()) {
                out.add("- **" + issue.severity() + "** `" + issue.type() + "`: " + issue.message());
            }
        }
        return String.join("\n", out);
    }

    private static String row(List<?> cells) {
        StringJoiner joiner = new StringJoiner(" | ", "| ", " |");
        for (Object cell : cells) {
            joiner.add(cell == null ? "NULL" : escape(cell.toString()));
        }
        return joiner.toString();
    }

    static String escape(String text) {
        return text.replace("|", "\\|").replace("\r\n", " ").replace('\n', ' ');
    }

    private static String orEmpty(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String orNa(Object value) {
        return value == null ? "N/A" : value.toString();
    }
}
