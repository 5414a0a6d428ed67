package com.dbprobe.prober.ops;

import com.dbprobe.core.CatalogDialect;
import com.dbprobe.core.DialectKind;
import com.dbprobe.repositories.mysql.MySqlCatalogDialect;
import com.dbprobe.repositories.oracle.OracleCatalogDialect;
import com.dbprobe.repositories.postgres.PostgresCatalogDialect;
import com.dbprobe.repositories.sqlserver.SqlServerCatalogDialect;

public final class Dialects {

    private Dialects() {}

    public static CatalogDialect of(DialectKind kind) {
        return switch (kind) {
            case ORACLE -> new OracleCatalogDialect();
            case MYSQL -> new MySqlCatalogDialect();
            case POSTGRESQL -> new PostgresCatalogDialect();
            case SQLSERVER -> new SqlServerCatalogDialect();
        };
    }
}
