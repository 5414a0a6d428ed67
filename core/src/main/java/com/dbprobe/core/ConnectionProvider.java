package com.dbprobe.core;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies connections by logical alias. Callers own the returned connection
 * and must close it.
 */
public interface ConnectionProvider {
    DialectKind resolveDialect(String alias);

    Connection open(String alias) throws SQLException;
}
