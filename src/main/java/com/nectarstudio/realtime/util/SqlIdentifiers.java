package com.nectarstudio.realtime.util;

import java.util.regex.Pattern;

/**
 * Validation for table and column names that end up inlined into SQL text.
 * Identifiers cannot be bound as parameters, so anything outside plain
 * {@code [schema.]name} syntax is rejected.
 */
public final class SqlIdentifiers {

    private static final Pattern COLUMN_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}");
    private static final Pattern TABLE_PATTERN =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,127}(\\.[A-Za-z_][A-Za-z0-9_]{0,127})?");

    private SqlIdentifiers() {
        // Utility class - prevent instantiation
    }

    public static boolean isValidColumn(String name) {
        return name != null && COLUMN_PATTERN.matcher(name).matches();
    }

    public static boolean isValidTable(String name) {
        return name != null && TABLE_PATTERN.matcher(name).matches();
    }

    public static String requireColumn(String name) {
        if (!isValidColumn(name)) {
            throw new IllegalArgumentException("Invalid column name: " + name);
        }
        return name;
    }

    public static String requireTable(String name) {
        if (!isValidTable(name)) {
            throw new IllegalArgumentException("Invalid table name: " + name);
        }
        return name;
    }

    /**
     * Table part of a possibly schema-qualified name.
     */
    public static String simpleName(String table) {
        int dot = table.lastIndexOf('.');
        return dot < 0 ? table : table.substring(dot + 1);
    }

    /**
     * Schema part of a qualified name, or null.
     */
    public static String schemaName(String table) {
        int dot = table.lastIndexOf('.');
        return dot < 0 ? null : table.substring(0, dot);
    }
}
