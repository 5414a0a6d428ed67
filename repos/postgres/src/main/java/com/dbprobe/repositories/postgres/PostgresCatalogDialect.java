package com.dbprobe.repositories.postgres;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repositories.rdbms.AbstractCatalogDialect;
import com.dbprobe.repositories.rdbms.SqlTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL folds unquoted identifiers to lower case. Partitions are not reported.
 */
public class PostgresCatalogDialect extends AbstractCatalogDialect {
    private static final NamedSql TABLE_COMMENT = NamedSql.parse(PostgresQueries.TABLE_COMMENT);
    private static final NamedSql COLUMNS = NamedSql.parse(PostgresQueries.COLUMNS);
    private static final NamedSql INDEX_COLUMNS = NamedSql.parse(PostgresQueries.INDEX_COLUMNS);
    private static final NamedSql STATISTICS = NamedSql.parse(PostgresQueries.STATISTICS);
    private static final SqlTemplate SEARCH = SqlTemplate.compile(PostgresQueries.SEARCH);

    @Override
    public DialectKind kind() {
        return DialectKind.POSTGRESQL;
    }

    @Override
    public IdentifierCase identifierCase() {
        return IdentifierCase.LOWER;
    }

    @Override
    public List<String> explain(String sql) {
        return List.of("EXPLAIN " + sql);
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
        return Optional.empty();
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
        return rs.getString("data_type");
    }

    @Override
    protected boolean nullable(ResultSet rs) throws SQLException {
        return rs.getBoolean("is_nullable");
    }
}
