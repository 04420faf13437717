package com.nectarstudio.realtime.source;

import java.sql.Types;

/**
 * Column metadata as reported by the source schema.
 */
public record ColumnInfo(String name, int jdbcType, String typeName) {

    public boolean isTemporal() {
        return switch (jdbcType) {
            case Types.DATE, Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> true;
            default -> typeName != null && typeName.toLowerCase(java.util.Locale.ROOT).matches(".*(date|timestamp).*");
        };
    }
}
