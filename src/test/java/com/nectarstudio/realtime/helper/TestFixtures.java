package com.nectarstudio.realtime.helper;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.detection.cleanup.CleanupStrategy;
import com.nectarstudio.realtime.detection.cleanup.TimeBasedCleanup;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import com.nectarstudio.realtime.source.ListQuery;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builders for the tables and jobs used across unit tests.
 */
public final class TestFixtures {

    public static final Set<String> ORDER_COLUMNS = Set.of("id", "customer", "status", "amount", "created_at", "updated_at");
    public static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private TestFixtures() {
    }

    public static TableDescriptor ordersTable() {
        return new TableDescriptor("shop", "orders", "orders", TriggerMode.NEW_ROW, "created_at", "id",
                0, false, 100, CleanupStrategyType.TIME_BASED, 5000, 30000, 300000, ORDER_COLUMNS);
    }

    public static TableDescriptor cdcTable(int batchSize) {
        return new TableDescriptor("shop", "order_events", "order_events", TriggerMode.NEW_ROW, "created_at", "id",
                0, true, batchSize, CleanupStrategyType.PROCESSED_MARKER, 5000, 30000, 300000,
                Set.of("id", "payload", "created_at", "processed", "processed_at"));
    }

    public static PollingJob ordersJob() {
        return job(ordersTable(), TableFilters.none(), new TimeBasedCleanup());
    }

    public static PollingJob job(TableDescriptor table, TableFilters filters, CleanupStrategy cleanup) {
        PollingJobKey key = PollingJobKey.of(table.serviceName(), table.entityName(), filters);
        ListQuery listQuery = ListQuery.compile(key.toFilters(), table.columns(), 100);
        return new PollingJob(key, table, listQuery, cleanup, T0);
    }

    public static RealtimeProperties properties() {
        return new RealtimeProperties();
    }

    public static Map<String, Object> row(Object id, Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }
}
