package com.dbprobe.repositories.rdbms;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HexFormat;

/**
 * Null-aware column readers. Catalog views differ in the numeric types they return
 * (NUMBER, DECIMAL, BIGINT, INT), so numbers are always read as objects and narrowed here.
 */
public final class Rows {

    private Rows() {}

    public static Long getLongOrNull(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value instanceof Number ? Long.valueOf(((Number) value).longValue()) : null;
    }

    public static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value instanceof Number ? Integer.valueOf(((Number) value).intValue()) : null;
    }

    public static int getInt(ResultSet rs, String column) throws SQLException {
        Integer value = getIntOrNull(rs, column);
        return value == null ? 0 : value;
    }

    /**
     * The column as text, with empty strings treated as absent.
     */
    public static String getStringOrNull(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null || value.isEmpty() ? null : value;
    }

    public static String getStringOrEmpty(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? "" : value;
    }

    /**
     * Reads a date or timestamp column as its display string, or null.
     */
    public static String getTemporalString(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value == null ? null : value.toString();
    }

    /**
     * Converts a cell returned by an ad-hoc query into something every formatter can print:
     * strings, numbers and booleans pass through and character LOBs are read. Anything else
     * is shown in its string form.
     */
    public static Object displayValue(Object value) throws SQLException {
        if (value == null || value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Clob) {
            return readClob((Clob) value);
        }
        if (value instanceof byte[]) {
            return "0x" + HexFormat.of().formatHex((byte[]) value);
        }
        return value.toString();
    }

    private static String readClob(Clob clob) throws SQLException {
        try (Reader reader = clob.getCharacterStream()) {
            StringBuilder text = new StringBuilder();
            char[] buffer = new char[4096];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                text.append(buffer, 0, read);
            }
            return text.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read CLOB value", e);
        }
    }
}
