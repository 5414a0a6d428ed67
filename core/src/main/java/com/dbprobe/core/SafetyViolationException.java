package com.dbprobe.core;

/**
 * Raised when a statement submitted for guarded execution is not read-only.
 * Always thrown before any statement reaches the connection.
 */
public class SafetyViolationException extends DbProbeException {
    private final String statement;

    public SafetyViolationException(String statement) {
        super("Only read-only SELECT/WITH/EXPLAIN statements are allowed; statement was blocked");
        this.statement = statement;
    }

    public String statement() {
        return statement;
    }
}
