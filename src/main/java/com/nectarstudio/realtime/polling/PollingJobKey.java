package com.nectarstudio.realtime.polling;

import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.source.FilterExpression;
import com.nectarstudio.realtime.source.ListQuery;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Identity of a deduplicated polling job: one table seen through one canonical filter set.
 * Build instances with {@link #of} so equivalent filters compare equal.
 */
public record PollingJobKey(
        String serviceName,
        String entityName,
        int page,
        List<String> fields,
        String sort,
        String filter
) {

    public PollingJobKey {
        Objects.requireNonNull(serviceName, "serviceName");
        Objects.requireNonNull(entityName, "entityName");
        fields = List.copyOf(fields);
    }

    public static PollingJobKey of(String serviceName, String entityName, TableFilters filters) {
        TableFilters f = filters != null ? filters : TableFilters.none();
        TreeSet<String> fields = new TreeSet<>();
        ListQuery.splitList(f.fields()).forEach(field -> fields.add(field.toLowerCase(Locale.ROOT)));
        String sort = ListQuery.splitList(f.sort()).stream()
                .map(part -> part.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT))
                .reduce((a, b) -> a + "," + b)
                .orElse(null);
        int page = f.page() == null || f.page() < 1 ? 1 : f.page();
        return new PollingJobKey(serviceName.trim(), entityName.trim(), page, List.copyOf(fields), sort,
                FilterExpression.normalize(f.filter()));
    }

    /**
     * Stable string form, used as the persisted cursor id.
     */
    public String canonical() {
        StringBuilder sb = new StringBuilder(serviceName).append('/').append(entityName)
                .append("?page=").append(page);
        if (!fields.isEmpty()) {
            sb.append("&fields=").append(String.join(",", fields));
        }
        if (sort != null) {
            sb.append("&sort=").append(sort);
        }
        if (filter != null) {
            sb.append("&filter=").append(filter);
        }
        return sb.toString();
    }

    /**
     * The filters this key stands for, as a list view would send them.
     */
    public TableFilters toFilters() {
        return new TableFilters(page, fields.isEmpty() ? null : String.join(",", fields), sort, filter);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
