package com.dbprobe.core.catalog;

import com.dbprobe.core.DialectKind;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The plan the engine reports for a read-only statement.
 *
 * @param lines  plan rows, one display line per row
 * @param issues findings for engines with plan analysis; empty elsewhere
 */
public record ExecutionPlan(
        @JsonProperty("db_type") DialectKind dialect,
        @JsonProperty("statement") String statement,
        @JsonProperty("lines") List<String> lines,
        @JsonProperty("issues") List<PlanIssue> issues
) {
    public ExecutionPlan {
        lines = List.copyOf(lines);
        issues = List.copyOf(issues);
    }
}
