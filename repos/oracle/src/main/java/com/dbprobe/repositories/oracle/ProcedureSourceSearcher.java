package com.dbprobe.repositories.oracle;

import com.dbprobe.core.catalog.ObjectType;
import com.dbprobe.core.catalog.ProcedureMatch;
import com.dbprobe.core.catalog.ProcedureQuery;
import com.dbprobe.core.catalog.SourceLine;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repositories.rdbms.NamedStatements;
import com.dbprobe.repositories.rdbms.Rows;
import com.dbprobe.repositories.rdbms.SqlTemplate;
import com.dbprobe.repositories.rdbms.StatementListener;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Finds stored programs whose source mentions a table or a piece of text, and returns
 * their complete source.
 * <p>
 * The search runs in two passes. The first reads only matching lines from ALL_SOURCE and
 * decides which objects qualify; the second fetches the whole body of each qualifying
 * object in one statement.
 */
public class ProcedureSourceSearcher {
    private static final SqlTemplate SOURCE_MATCHES = SqlTemplate.compile(OracleQueries.SOURCE_MATCHES);
    private static final SqlTemplate SOURCE_BODIES = SqlTemplate.compile(OracleQueries.SOURCE_BODIES);
    private static final SqlTemplate SOURCE_BY_NAME = SqlTemplate.compile(OracleQueries.SOURCE_BY_NAME);

    private final StatementListener listener;

    public ProcedureSourceSearcher() {
        this(StatementListener.NONE);
    }

    public ProcedureSourceSearcher(StatementListener listener) {
        this.listener = listener;
    }

    public List<ProcedureMatch> search(Connection conn, ProcedureQuery query) throws SQLException {
        if (!query.hasFilter()) {
            return List.of();
        }

        Map<String, Object> binds = new LinkedHashMap<>();
        List<String> types = bindTypes(query.objectTypes(), binds);
        List<String> conditions = new ArrayList<>();
        if (query.tableName() != null) {
            conditions.add(textCondition(query.tableName(), query.regex(), "re_table", "table_val", binds));
        }
        if (query.text() != null) {
            conditions.add(textCondition(query.text(), query.regex(), "re_text", "text_val", binds));
        }
        if (query.schema() != null) {
            binds.put("schema", query.schema().toUpperCase(Locale.ROOT));
        }

        Map<String, Object> context = new HashMap<>();
        context.put("types", types);
        context.put("textCondition", "(" + String.join(") OR (", conditions) + ")");
        context.put("schema", query.schema() != null);
        NamedSql matchSql = SOURCE_MATCHES.render(context);

        SourceMatchAccumulator accumulator = new SourceMatchAccumulator(query.tableName(), query.text(), query.regex());
        listener.beforeExecute(matchSql, binds);
        try (PreparedStatement stmt = NamedStatements.prepare(conn, matchSql, binds);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                Optional<SourceObjectKey> key = key(rs);
                if (key.isPresent()) {
                    accumulator.accept(key.get(), Rows.getInt(rs, "line"), Rows.getStringOrEmpty(rs, "text"));
                }
            }
        }

        List<SourceObjectKey> selected = accumulator.selected(query.objectLimit());
        if (selected.isEmpty()) {
            return List.of();
        }

        Map<SourceObjectKey, List<SourceLine>> bodies = fetchBodies(conn, selected);
        List<ProcedureMatch> result = new ArrayList<>(selected.size());
        for (SourceObjectKey key : selected) {
            result.add(new ProcedureMatch(key.owner(), key.name(), key.type(),
                    accumulator.matchCount(key),
                    accumulator.matchingLines(key),
                    limitLines(bodies.getOrDefault(key, List.of()), query.lineLimit())));
        }
        return result;
    }

    /**
     * Fetches complete source by object name. {@code objectName} may be qualified as
     * {@code OWNER.NAME}; otherwise {@code schema}, when given, restricts the owner.
     */
    public List<ProcedureMatch> fetchByName(Connection conn, String objectName, String schema,
                                            List<ObjectType> objectTypes, int lineLimit) throws SQLException {
        String name = objectName.trim();
        String owner = schema;
        int dot = name.indexOf('.');
        if (dot >= 0) {
            owner = name.substring(0, dot);
            name = name.substring(dot + 1);
        }

        Map<String, Object> binds = new LinkedHashMap<>();
        List<String> types = bindTypes(
                objectTypes == null || objectTypes.isEmpty() ? List.of(ObjectType.values()) : objectTypes, binds);
        binds.put("objname", name.trim().toUpperCase(Locale.ROOT));
        boolean hasOwner = owner != null && !owner.isBlank();
        if (hasOwner) {
            binds.put("owner", owner.trim().toUpperCase(Locale.ROOT));
        }

        Map<String, Object> context = new HashMap<>();
        context.put("types", types);
        context.put("owner", hasOwner);
        NamedSql sql = SOURCE_BY_NAME.render(context);

        listener.beforeExecute(sql, binds);
        Map<SourceObjectKey, List<SourceLine>> bodies = readBodies(conn, sql, binds);

        List<ProcedureMatch> result = new ArrayList<>(bodies.size());
        bodies.entrySet().stream()
                .sorted(Map.Entry.comparingByKey(SourceObjectKey.CATALOG_ORDER))
                .forEach(e -> result.add(new ProcedureMatch(e.getKey().owner(), e.getKey().name(),
                        e.getKey().type(), 0, List.of(), limitLines(e.getValue(), lineLimit))));
        return result;
    }

    private Map<SourceObjectKey, List<SourceLine>> fetchBodies(Connection conn, List<SourceObjectKey> keys)
            throws SQLException {
        Map<String, Object> binds = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            SourceObjectKey key = keys.get(i);
            binds.put("o" + i, key.owner());
            binds.put("n" + i, key.name());
            binds.put("t" + i, key.type().catalogName());
        }
        NamedSql sql = SOURCE_BODIES.render(Map.of("keys", keys));
        listener.beforeExecute(sql, binds);
        return readBodies(conn, sql, binds);
    }

    private static Map<SourceObjectKey, List<SourceLine>> readBodies(Connection conn, NamedSql sql,
                                                                      Map<String, Object> binds) throws SQLException {
        Map<SourceObjectKey, List<SourceLine>> bodies = new LinkedHashMap<>();
        try (PreparedStatement stmt = NamedStatements.prepare(conn, sql, binds);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                Optional<SourceObjectKey> key = key(rs);
                if (key.isPresent()) {
                    bodies.computeIfAbsent(key.get(), k -> new ArrayList<>())
                            .add(new SourceLine(Rows.getInt(rs, "line"),
                                    Rows.getStringOrEmpty(rs, "text").stripTrailing()));
                }
            }
        }
        return bodies;
    }

    private static Optional<SourceObjectKey> key(ResultSet rs) throws SQLException {
        String owner = rs.getString("owner");
        String name = rs.getString("name");
        return ObjectType.fromCatalogName(rs.getString("type"))
                .map(type -> new SourceObjectKey(owner, name, type));
    }

    private static List<String> bindTypes(List<ObjectType> objectTypes, Map<String, Object> binds) {
        List<String> types = new ArrayList<>(objectTypes.size());
        for (ObjectType type : objectTypes) {
            binds.put("typ" + types.size(), type.catalogName());
            types.add(type.catalogName());
        }
        return types;
    }

    private static String textCondition(String value, boolean regex, String regexBind, String likeBind,
                                        Map<String, Object> binds) {
        if (regex) {
            binds.put(regexBind, value);
            return "REGEXP_LIKE(text, :" + regexBind + ", 'i')";
        }
        binds.put(likeBind, value.trim().toUpperCase(Locale.ROOT));
        return "UPPER(text) LIKE '%' || :" + likeBind + " || '%'";
    }

    private static List<SourceLine> limitLines(List<SourceLine> lines, int lineLimit) {
        if (lineLimit > 0 && lines.size() > lineLimit) {
            return lines.subList(0, lineLimit);
        }
        return lines;
    }
}
