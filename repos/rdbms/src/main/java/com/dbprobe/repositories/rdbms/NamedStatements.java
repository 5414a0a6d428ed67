package com.dbprobe.repositories.rdbms;

import com.dbprobe.core.sql.NamedSql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@link NamedSql} through JDBC, binding values positionally in marker order.
 */
public final class NamedStatements {

    private NamedStatements() {}

    /**
     * Prepares {@code sql} with every marker bound. The caller owns the returned statement.
     *
     * @throws IllegalArgumentException when a marker has no value in {@code binds}
     */
    public static PreparedStatement prepare(Connection conn, NamedSql sql, Map<String, ?> binds) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(sql.jdbcSql());
        try {
            int index = 1;
            for (String name : sql.parameterNames()) {
                if (!binds.containsKey(name)) {
                    throw new IllegalArgumentException("No value bound for :" + name);
                }
                stmt.setObject(index++, binds.get(name));
            }
            return stmt;
        } catch (SQLException | RuntimeException e) {
            stmt.close();
            throw e;
        }
    }

    public static <T> List<T> list(Connection conn, NamedSql sql, Map<String, ?> binds, RowMapper<T> mapper)
            throws SQLException {
        List<T> result = new ArrayList<>();
        try (PreparedStatement stmt = prepare(conn, sql, binds);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                result.add(mapper.map(rs));
            }
        }
        return result;
    }

    public static <T> Optional<T> first(Connection conn, NamedSql sql, Map<String, ?> binds, RowMapper<T> mapper)
            throws SQLException {
        try (PreparedStatement stmt = prepare(conn, sql, binds);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.ofNullable(mapper.map(rs));
            }
        }
        return Optional.empty();
    }
}
