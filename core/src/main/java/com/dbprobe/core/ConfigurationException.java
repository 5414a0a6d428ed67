package com.dbprobe.core;

/**
 * An alias is missing its dialect marker, names an unsupported engine,
 * or lacks the keys needed to build a connection.
 */
public class ConfigurationException extends DbProbeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
