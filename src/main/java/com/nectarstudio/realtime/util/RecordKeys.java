package com.nectarstudio.realtime.util;

import java.util.Map;
import java.util.Objects;

/**
 * Key lookup for opaque row payloads. Drivers differ in how they case column labels,
 * so {@code id}, {@code Id} and {@code ID} are all accepted.
 */
public final class RecordKeys {

    public static final String DEFAULT_KEY = "id";

    private RecordKeys() {
        // Utility class - prevent instantiation
    }

    public static Object idOf(Map<String, ?> record) {
        return valueOf(record, DEFAULT_KEY);
    }

    public static Object valueOf(Map<String, ?> record, String column) {
        if (record == null || column == null) {
            return null;
        }
        Object value = record.get(column);
        if (value != null) {
            return value;
        }
        for (Map.Entry<String, ?> entry : record.entrySet()) {
            if (column.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Compares ids loosely: JSON decoding turns a BIGINT key into Integer or Long
     * depending on magnitude, so numbers compare by value and everything else by string form.
     */
    public static boolean sameId(Object left, Object right) {
        if (left == null || right == null) {
            return false;
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return l.longValue() == r.longValue();
            }
            return Double.compare(l.doubleValue(), r.doubleValue()) == 0;
        }
        return Objects.equals(String.valueOf(left), String.valueOf(right));
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }
}
