package com.dbprobe.repositories.oracle;

import java.util.Set;

/**
 * Builds the familiar Oracle type spelling from the split ALL_TAB_COLUMNS type columns.
 */
public final class OracleTypes {
    private static final Set<String> LENGTH_TYPES = Set.of("VARCHAR2", "CHAR", "NVARCHAR2", "NCHAR");

    private OracleTypes() {}

    public static String render(String dataType, Integer length, Integer precision, Integer scale) {
        if (dataType == null) {
            return null;
        }
        if (LENGTH_TYPES.contains(dataType) && length != null) {
            return dataType + "(" + length + ")";
        }
        if ("NUMBER".equals(dataType) && precision != null && precision > 0) {
            if (scale != null && scale > 0) {
                return dataType + "(" + precision + "," + scale + ")";
            }
            return dataType + "(" + precision + ")";
        }
        return dataType;
    }
}
