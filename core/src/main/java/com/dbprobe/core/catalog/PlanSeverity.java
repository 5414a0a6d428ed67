package com.dbprobe.core.catalog;

public enum PlanSeverity {
    OK,
    INFO,
    WARNING,
    CRITICAL
}
