package com.nectarstudio.realtime.source;

import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.model.dto.TableFilters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link TableFilters} validated against a table's columns and turned into query parts.
 */
public record ListQuery(RowPredicate where, List<String> fields, String orderBy, int offset, int limit) {

    public static ListQuery compile(TableFilters filters, Set<String> columns, int pageSize) {
        Map<String, String> byLowerName = new LinkedHashMap<>();
        columns.forEach(c -> byLowerName.put(c.toLowerCase(Locale.ROOT), c));

        RowPredicate where = FilterExpression.compile(filters.filter(), columns, "f");
        List<String> fields = new ArrayList<>();
        for (String field : splitList(filters.fields())) {
            fields.add(column(byLowerName, field, "field"));
        }

        List<String> sortParts = new ArrayList<>();
        for (String part : splitList(filters.sort())) {
            String[] words = part.trim().split("\\s+");
            if (words.length > 2) {
                throw new SubscriptionConfigurationException("Invalid sort: '" + part + "'");
            }
            String direction = words.length == 2 ? words[1].toUpperCase(Locale.ROOT) : "ASC";
            if (!direction.equals("ASC") && !direction.equals("DESC")) {
                throw new SubscriptionConfigurationException("Invalid sort direction: '" + words[1] + "'");
            }
            sortParts.add(column(byLowerName, words[0], "sort column") + " " + direction);
        }

        int page = filters.page() == null || filters.page() < 1 ? 1 : filters.page();
        return new ListQuery(where, List.copyOf(fields), sortParts.isEmpty() ? null : String.join(", ", sortParts),
                (page - 1) * pageSize, pageSize);
    }

    /**
     * Splits a comma separated list, dropping blanks.
     */
    public static List<String> splitList(String value) {
        List<String> parts = new ArrayList<>();
        if (value == null) {
            return parts;
        }
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    private static String column(Map<String, String> byLowerName, String name, String role) {
        String column = byLowerName.get(name.toLowerCase(Locale.ROOT));
        if (column == null) {
            throw new SubscriptionConfigurationException("Unknown " + role + " '" + name + "'");
        }
        return column;
    }
}
