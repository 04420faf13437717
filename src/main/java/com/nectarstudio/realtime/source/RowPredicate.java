package com.nectarstudio.realtime.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A SQL {@code WHERE} fragment with named parameters, e.g. {@code created_at > :cursor}.
 * Column names inside {@code sql} must already be validated.
 */
public record RowPredicate(String sql, Map<String, Object> params) {

    private static final RowPredicate ALWAYS = new RowPredicate("1 = 1", Map.of());

    public RowPredicate {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static RowPredicate always() {
        return ALWAYS;
    }

    public static RowPredicate of(String sql) {
        return new RowPredicate(sql, Map.of());
    }

    public static RowPredicate of(String sql, String param, Object value) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put(param, value);
        return new RowPredicate(sql, params);
    }

    public boolean isAlways() {
        return this == ALWAYS;
    }

    public RowPredicate and(RowPredicate other) {
        if (other == null || other.isAlways()) {
            return this;
        }
        if (isAlways()) {
            return other;
        }
        Map<String, Object> merged = new LinkedHashMap<>(params);
        other.params.forEach((name, value) -> {
            if (merged.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate predicate parameter: " + name);
            }
            merged.put(name, value);
        });
        return new RowPredicate("(" + sql + ") AND (" + other.sql + ")", merged);
    }
}
