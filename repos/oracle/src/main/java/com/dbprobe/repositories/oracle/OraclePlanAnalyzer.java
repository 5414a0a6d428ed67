package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.PlanIssue;
import com.dbprobe.core.catalog.PlanSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scans DBMS_XPLAN.DISPLAY output for operations that usually deserve attention.
 */
public class OraclePlanAnalyzer {
    public static final long HIGH_COST_THRESHOLD = 100_000L;

    private static final Pattern COST_CELL = Pattern.compile("^(\\d{1,18})(\\s*\\(\\d+\\))?$");

    public List<PlanIssue> analyze(List<String> planLines) {
        List<PlanIssue> issues = new ArrayList<>();
        int costColumn = -1;

        for (String line : planLines) {
            String[] cells = line.split("\\|");
            String upper = line.toUpperCase(Locale.ROOT);

            int header = headerIndex(cells, "COST");
            if (header >= 0) {
                costColumn = header;
                continue;
            }

            if (upper.contains("TABLE ACCESS FULL")) {
                String table = cellAfter(cells, "TABLE ACCESS FULL");
                issues.add(new PlanIssue("FULL_TABLE_SCAN", PlanSeverity.WARNING, table.isEmpty()
                        ? "Full table scan; check whether an index could be used"
                        : "Full table scan on " + table + "; check whether an index could be used"));
            }
            if (upper.contains("MERGE JOIN CARTESIAN")) {
                issues.add(new PlanIssue("CARTESIAN_PRODUCT", PlanSeverity.CRITICAL,
                        "Cartesian product (MERGE JOIN CARTESIAN); a join condition is probably missing"));
            }
            if (upper.contains("HASH JOIN")) {
                issues.add(new PlanIssue("HASH_JOIN", PlanSeverity.INFO,
                        "Hash join; fine for large sets, check memory if it spills to temp"));
            }

            long cost = cost(cells, costColumn);
            if (cost >= HIGH_COST_THRESHOLD) {
                issues.add(new PlanIssue("HIGH_COST", PlanSeverity.WARNING,
                        "High estimated cost " + cost + " (threshold " + HIGH_COST_THRESHOLD + ")"));
            }
        }

        if (issues.isEmpty()) {
            issues.add(new PlanIssue("NO_ISSUES", PlanSeverity.OK, "No obvious problems found in the plan"));
        }
        return issues;
    }

    private static int headerIndex(String[] cells, String name) {
        for (int i = 0; i < cells.length; i++) {
            if (cells[i].trim().toUpperCase(Locale.ROOT).startsWith(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String cellAfter(String[] cells, String operation) {
        for (int i = 0; i < cells.length - 1; i++) {
            if (cells[i].toUpperCase(Locale.ROOT).contains(operation)) {
                return cells[i + 1].trim();
            }
        }
        return "";
    }

    /**
     * The cost on this line: the cost column once a header has been seen, otherwise the
     * largest numeric cell. Returns -1 when there is none.
     */
    private static long cost(String[] cells, int costColumn) {
        if (costColumn >= 0) {
            return costColumn < cells.length ? numeric(cells[costColumn]) : -1;
        }
        long max = -1;
        for (String cell : cells) {
            max = Math.max(max, numeric(cell));
        }
        return max;
    }

    private static long numeric(String cell) {
        Matcher matcher = COST_CELL.matcher(cell.trim());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : -1;
    }
}
