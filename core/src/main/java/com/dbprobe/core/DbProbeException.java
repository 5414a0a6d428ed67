package com.dbprobe.core;

/**
 * Base type for the failures dbprobe raises itself. Driver failures travel as
 * {@link java.sql.SQLException} and are never wrapped.
 */
public abstract class DbProbeException extends RuntimeException {
    protected DbProbeException(String message) {
        super(message);
    }
}
