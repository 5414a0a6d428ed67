package com.dbprobe.repositories.sqlserver;

import java.util.Locale;
import java.util.Set;

/**
 * Builds SQL Server type spellings from sys.columns. Lengths are reported as stored in
 * {@code max_length}, which is in bytes, so {@code nvarchar(50)} shows as {@code nvarchar(100)}.
 */
public final class SqlServerTypes {
    private static final Set<String> LENGTH_TYPES = Set.of("varchar", "nvarchar", "char", "nchar");
    private static final Set<String> DECIMAL_TYPES = Set.of("decimal", "numeric");

    private SqlServerTypes() {}

    public static String render(String typeName, Integer maxLength, Integer precision, Integer scale) {
        if (typeName == null) {
            return null;
        }
        String base = typeName.toLowerCase(Locale.ROOT);
        if (LENGTH_TYPES.contains(base) && maxLength != null) {
            return typeName + "(" + (maxLength == -1 ? "MAX" : maxLength.toString()) + ")";
        }
        if (DECIMAL_TYPES.contains(base) && precision != null && scale != null) {
            return typeName + "(" + precision + "," + scale + ")";
        }
        return typeName;
    }
}
