package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.sql.NamedSql;

import java.util.Map;

/**
 * Notified with each catalog statement and its bind values just before it is executed.
 */
@FunctionalInterface
public interface StatementListener {
    StatementListener NONE = (sql, binds) -> {};

    void beforeExecute(NamedSql sql, Map<String, ?> binds);
}
