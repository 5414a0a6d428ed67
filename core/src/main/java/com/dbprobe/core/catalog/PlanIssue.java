package com.dbprobe.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One finding from reading an execution plan.
 *
 * @param type short machine-readable code such as {@code FULL_TABLE_SCAN}
 */
public record PlanIssue(
        @JsonProperty("type") String type,
        @JsonProperty("severity") PlanSeverity severity,
        @JsonProperty("message") String message
) {}
