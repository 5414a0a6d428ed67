package com.dbprobe.repos.certification;

import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.mockito.Mockito.mock;

/**
 * A JDBC connection double that answers statements from a script.
 * <p>
 * Each rule pairs a SQL fragment with the rows to return; the first rule whose fragment
 * occurs in a statement (case and whitespace insensitive) answers it, and statements no
 * rule matches return no rows. Every executed statement is recorded with its binds.
 * Columns are looked up by label case-insensitively, and an unknown label fails the way
 * a driver would.
 */
public final class ScriptedJdbc {

    public record Executed(String sql, List<Object> binds) {}

    private record Rule(String fragment, List<Map<String, Object>> rows, SQLException failure) {}

    private final List<Rule> rules = new ArrayList<>();
    private final List<Executed> executed = new ArrayList<>();
    private boolean readOnly;

    public static Map<String, Object> row(Object... labelsAndValues) {
        if (labelsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("row needs label/value pairs");
        }
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < labelsAndValues.length; i += 2) {
            row.put((String) labelsAndValues[i], labelsAndValues[i + 1]);
        }
        return row;
    }

    @SafeVarargs
    public final ScriptedJdbc on(String fragment, Map<String, Object>... rows) {
        return on(fragment, List.of(rows));
    }

    public ScriptedJdbc on(String fragment, List<Map<String, Object>> rows) {
        rules.add(new Rule(normalize(fragment), List.copyOf(rows), null));
        return this;
    }

    public ScriptedJdbc failOn(String fragment, SQLException failure) {
        rules.add(new Rule(normalize(fragment), List.of(), failure));
        return this;
    }

    public Connection connection() {
        return mock(Connection.class, this::connectionCall);
    }

    public List<Executed> executed() {
        return Collections.unmodifiableList(executed);
    }

    public Executed lastExecuted() {
        if (executed.isEmpty()) {
            throw new AssertionError("No statement was executed");
        }
        return executed.get(executed.size() - 1);
    }

    public Executed executedMatching(String fragment) {
        String wanted = normalize(fragment);
        return executed.stream()
                .filter(e -> normalize(e.sql()).contains(wanted))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No executed statement contains: " + fragment));
    }

    public boolean readOnlyRequested() {
        return readOnly;
    }

    private Object connectionCall(InvocationOnMock invocation) throws Throwable {
        switch (invocation.getMethod().getName()) {
            case "prepareStatement":
                return preparedStatement(invocation.getArgument(0));
            case "createStatement":
                return mock(Statement.class, this::statementCall);
            case "setReadOnly":
                readOnly = invocation.getArgument(0);
                return null;
            case "isReadOnly":
                return readOnly;
            default:
                return Mockito.RETURNS_DEFAULTS.answer(invocation);
        }
    }

    private PreparedStatement preparedStatement(String sql) {
        List<Object> binds = new ArrayList<>();
        return mock(PreparedStatement.class, invocation -> {
            String name = invocation.getMethod().getName();
            Object[] args = invocation.getArguments();
            if (name.equals("executeQuery") && args.length == 0) {
                return execute(sql, binds);
            }
            if (name.startsWith("set") && args.length >= 2 && args[0] instanceof Integer
                    && !name.equals("setFetchSize") && !name.equals("setMaxRows")) {
                int index = (Integer) args[0];
                while (binds.size() < index) {
                    binds.add(null);
                }
                binds.set(index - 1, args[1]);
                return null;
            }
            return Mockito.RETURNS_DEFAULTS.answer(invocation);
        });
    }

    private Object statementCall(InvocationOnMock invocation) throws Throwable {
        String name = invocation.getMethod().getName();
        if (name.equals("executeQuery")) {
            return execute(invocation.getArgument(0), List.of());
        }
        if (name.equals("execute") || name.equals("executeUpdate")) {
            execute(invocation.getArgument(0), List.of());
            return name.equals("execute") ? Boolean.FALSE : Integer.valueOf(0);
        }
        return Mockito.RETURNS_DEFAULTS.answer(invocation);
    }

    private ResultSet execute(String sql, List<Object> binds) throws SQLException {
        executed.add(new Executed(sql, new ArrayList<>(binds)));
        String normalized = normalize(sql);
        for (Rule rule : rules) {
            if (normalized.contains(rule.fragment())) {
                if (rule.failure() != null) {
                    throw rule.failure();
                }
                return resultSet(rule.rows());
            }
        }
        return resultSet(List.of());
    }

    private static ResultSet resultSet(List<Map<String, Object>> rows) {
        List<String> labels = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
        ResultSetMetaData meta = mock(ResultSetMetaData.class, invocation -> {
            switch (invocation.getMethod().getName()) {
                case "getColumnCount":
                    return labels.size();
                case "getColumnLabel":
                case "getColumnName":
                    return labels.get((Integer) invocation.getArgument(0) - 1);
                default:
                    return Mockito.RETURNS_DEFAULTS.answer(invocation);
            }
        });

        int[] cursor = {-1};
        return mock(ResultSet.class, invocation -> {
            String name = invocation.getMethod().getName();
            switch (name) {
                case "next":
                    cursor[0]++;
                    return cursor[0] < rows.size();
                case "getMetaData":
                    return meta;
                case "getObject":
                case "getString":
                case "getInt":
                case "getLong":
                case "getBoolean":
                    if (cursor[0] < 0 || cursor[0] >= rows.size()) {
                        throw new SQLException("Result set is not positioned on a row");
                    }
                    Object column = invocation.getArgument(0);
                    Object value = column instanceof Integer
                            ? cell(rows.get(cursor[0]), labels.get((Integer) column - 1))
                            : cell(rows.get(cursor[0]), (String) column);
                    return convert(name, value);
                default:
                    return Mockito.RETURNS_DEFAULTS.answer(invocation);
            }
        });
    }

    private static Object cell(Map<String, Object> row, String label) throws SQLException {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(label)) {
                return entry.getValue();
            }
        }
        throw new SQLException("Invalid column name: " + label);
    }

    private static Object convert(String getter, Object value) {
        switch (getter) {
            case "getString":
                return value == null ? null : value.toString();
            case "getInt":
                return value == null ? 0 : ((Number) value).intValue();
            case "getLong":
                return value == null ? 0L : ((Number) value).longValue();
            case "getBoolean":
                if (value == null) {
                    return false;
                }
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof Number) {
                    return ((Number) value).intValue() != 0;
                }
                return List.of("Y", "YES", "TRUE", "1").contains(value.toString().toUpperCase(Locale.ROOT));
            default:
                return value;
        }
    }

    private static String normalize(String sql) {
        return sql.replaceAll("\\s+", " ").trim().toUpperCase(Locale.ROOT);
    }
}
