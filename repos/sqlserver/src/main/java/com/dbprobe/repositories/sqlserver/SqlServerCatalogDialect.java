package com.dbprobe.repositories.sqlserver;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.DialectUnsupportedException;
import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repositories.rdbms.AbstractCatalogDialect;
import com.dbprobe.repositories.rdbms.Rows;
import com.dbprobe.repositories.rdbms.SqlTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class SqlServerCatalogDialect extends AbstractCatalogDialect {
    private static final NamedSql TABLE_COMMENT = NamedSql.parse(SqlServerQueries.TABLE_COMMENT);
    private static final NamedSql COLUMNS = NamedSql.parse(SqlServerQueries.COLUMNS);
    private static final NamedSql INDEX_COLUMNS = NamedSql.parse(SqlServerQueries.INDEX_COLUMNS);
    private static final NamedSql PARTITIONS = NamedSql.parse(SqlServerQueries.PARTITIONS);
    private static final NamedSql STATISTICS = NamedSql.parse(SqlServerQueries.STATISTICS);
    private static final SqlTemplate SEARCH = SqlTemplate.compile(SqlServerQueries.SEARCH);

    @Override
    public DialectKind kind() {
        return DialectKind.SQLSERVER;
    }

    @Override
    public IdentifierCase identifierCase() {
        return IdentifierCase.UPPER;
    }

    /**
     * Plans would need SET SHOWPLAN_TEXT on a dedicated session, which this tool does not manage.
     */
    @Override
    public List<String> explain(String sql) {
        throw new DialectUnsupportedException(kind(), "explain");
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
    protected String dataType(ResultSet rs) throws SQLException {
        return SqlServerTypes.render(
                rs.getString("type_name"),
                Rows.getIntOrNull(rs, "max_length"),
                Rows.getIntOrNull(rs, "numeric_precision"),
                Rows.getIntOrNull(rs, "numeric_scale"));
    }

    @Override
    protected boolean nullable(ResultSet rs) throws SQLException {
        return rs.getBoolean("is_nullable");
    }
}
