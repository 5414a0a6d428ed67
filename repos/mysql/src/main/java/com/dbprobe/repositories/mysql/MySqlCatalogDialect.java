package com.dbprobe.repositories.mysql;

import com.dbprobe.core.DialectKind;
import com.dbprobe.core.catalog.IdentifierCase;
import com.dbprobe.core.sql.NamedSql;
import com.dbprobe.repositories.rdbms.AbstractCatalogDialect;
import com.dbprobe.repositories.rdbms.SqlTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public class MySqlCatalogDialect extends AbstractCatalogDialect {
    private static final NamedSql TABLE_COMMENT = NamedSql.parse(MySqlQueries.TABLE_COMMENT);
    private static final NamedSql COLUMNS = NamedSql.parse(MySqlQueries.COLUMNS);
    private static final NamedSql INDEX_COLUMNS = NamedSql.parse(MySqlQueries.INDEX_COLUMNS);
    private static final NamedSql PARTITIONS = NamedSql.parse(MySqlQueries.PARTITIONS);
    private static final NamedSql STATISTICS = NamedSql.parse(MySqlQueries.STATISTICS);
    private static final SqlTemplate SEARCH = SqlTemplate.compile(MySqlQueries.SEARCH);

    @Override
    public DialectKind kind() {
        return DialectKind.MYSQL;
    }

    @Override
    public IdentifierCase identifierCase() {
        return IdentifierCase.UPPER;
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
        return rs.getString("data_type");
    }

    @Override
    protected boolean nullable(ResultSet rs) throws SQLException {
        return "YES".equals(rs.getString("is_nullable"));
    }
}
