package com.dbprobe.repositories.oracle;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.catalog.PlanIssue;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repositories.rdbms.AbstractCatalogDialect;
import com.dbprobe.repositories.rdbms.Rows;
import com.dbprobe.repositories.rdbms.SqlTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class OracleCatalogDialect extends AbstractCatalogDialect {
    private static final NamedSql TABLE_COMMENT = NamedSql.parse(OracleQueries.TABLE_COMMENT);
    private static final NamedSql COLUMNS = NamedSql.parse(OracleQueries.COLUMNS);
    private static final NamedSql INDEX_COLUMNS = NamedSql.parse(OracleQueries.INDEX_COLUMNS);
    private static final NamedSql PARTITIONS = NamedSql.parse(OracleQueries.PARTITIONS);
    private static final NamedSql STATISTICS = NamedSql.parse(OracleQueries.STATISTICS);
    private static final SqlTemplate SEARCH = SqlTemplate.compile(OracleQueries.SEARCH);

    private final OraclePlanAnalyzer planAnalyzer = new OraclePlanAnalyzer();

    @Override
    public DialectKind kind() {
        return DialectKind.ORACLE;
    }

    @Override
    public IdentifierCase identifierCase() {
        return IdentifierCase.UPPER;
    }

    @Override
    public String pingSql() {
        return "SELECT 1 FROM DUAL";
    }

    @Override
    public List<String> explain(String sql) {
        return List.of("EXPLAIN PLAN FOR " + sql, OracleQueries.PLAN_OUTPUT);
    }

    @Override
    public List<PlanIssue> analyzePlan(List<String> planLines) {
        return planAnalyzer.analyze(planLines);
    }

    @Override
    protected NamedSql tableCommentSql() {
        return TABLE_COMMENT;
    }

    @Override
    protected NamedSql columnsSql() {
        return COLUMNS;
    }

    @Override
    protected NamedSql indexColumnsSql() {
        return INDEX_COLUMNS;
    }

    @Override
    protected Optional<NamedSql> partitionsSql() {
        return Optional.of(PARTITIONS);
    }

    @Override
    protected NamedSql statisticsSql() {
        return STATISTICS;
    }

    @Override
    protected SqlTemplate searchTemplate() {
        return SEARCH;
    }

    @Override
    protected String searchSchema(String schema) {
        return schema.toUpperCase(Locale.ROOT);
    }

    @Override
    protected String dataType(ResultSet rs) throws SQLException {
        return OracleTypes.render(
                rs.getString("data_type"),
                Rows.getIntOrNull(rs, "data_length"),
                Rows.getIntOrNull(rs, "data_precision"),
                Rows.getIntOrNull(rs, "data_scale"));
    }

    @Override
    protected boolean nullable(ResultSet rs) throws SQLException {
        return "Y".equals(rs.getString("is_nullable"));
    }
}
