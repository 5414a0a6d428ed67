package com.dbprobe.core;

public class DialectUnsupportedException extends DbProbeException {
    private final DialectKind dialect;
    private final String operation;

    public DialectUnsupportedException(DialectKind dialect, String operation) {
        super(operation + " is not supported for " + dialect + " databases");
        this.dialect = dialect;
        this.operation = operation;
    }

    public DialectKind dialect() {
        return dialect;
    }

    public String operation() {
        return operation;
    }
}
