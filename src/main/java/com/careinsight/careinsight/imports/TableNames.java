package com.careinsight.careinsight.imports;

/**
 * Guards identifiers that are concatenated into SQL.
 */
public final class TableNames {

    private TableNames() {
    }

    /**
     * Allows only safe identifier characters for table names.
     */
    public static String sanitize(String input) {
        if (input == null || !input.matches(ImportConstants.VALID_TABLE_NAME_REGEX)) {
            throw new IllegalArgumentException(ImportConstants.MSG_INVALID_TABLE.formatted(input));
        }
        return input;
    }

    /**
     * Double-quotes a column name exactly as the database reported it.
     */
    public static String quoteColumn(String column) {
        return "\"" + column.replace("\"", "\"\"") + "\"";
    }
}
