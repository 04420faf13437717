package com.nectarstudio.realtime.service;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.config.RealtimeProperties.ServiceDefinition;
import com.nectarstudio.realtime.config.RealtimeProperties.TableDefinition;
import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.detection.TimestampColumnResolver;
import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;
import com.nectarstudio.realtime.source.ColumnInfo;
import com.nectarstudio.realtime.source.TableRowSource;
import com.nectarstudio.realtime.util.SqlIdentifiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves {@code (serviceName, entityName)} to a {@link TableDescriptor} from the
 * {@code app.realtime.services} catalog and the table's metadata. Resolved descriptors are cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityCatalog {

    private static final String PROCESSED_COLUMN = "processed";

    private final RealtimeProperties properties;
    private final TableRowSource tableRowSource;
    private final TimestampColumnResolver timestampColumnResolver;

    private final Map<String, TableDescriptor> cache = new ConcurrentHashMap<>();

    /**
     * @throws SubscriptionConfigurationException for an unknown service or entity, a missing table,
     *                                            or a table with no usable watermark column
     */
    public TableDescriptor resolve(String serviceName, String entityName) {
        if (serviceName == null || serviceName.isBlank() || entityName == null || entityName.isBlank()) {
            throw new SubscriptionConfigurationException("serviceName and entityName are required");
        }
        String cacheKey = serviceName.trim().toLowerCase(Locale.ROOT) + "/" + entityName.trim().toLowerCase(Locale.ROOT);
        TableDescriptor cached = cache.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        TableDescriptor descriptor = load(serviceName.trim(), entityName.trim());
        cache.put(cacheKey, descriptor);
        return descriptor;
    }

    /**
     * Drops cached descriptors, e.g. after a table was altered.
     */
    public void evictAll() {
        cache.clear();
        log.info("🧹 Entity catalog cache cleared");
    }

    private TableDescriptor load(String serviceName, String entityName) {
        ServiceDefinition service = properties.getServices().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(serviceName))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new SubscriptionConfigurationException("Unknown service '" + serviceName + "'"));

        TableDefinition definition = service.getTables().entrySet().stream()
                .filter(e -> e.getKey().equalsIgnoreCase(entityName))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseGet(() -> {
                    if (!service.isAutoDiscover()) {
                        throw new SubscriptionConfigurationException(
                                "Entity '" + entityName + "' is not exposed by service '" + serviceName + "'");
                    }
                    return new TableDefinition();
                });

        String table = definition.getTable() != null ? definition.getTable() : entityName;
        if (!SqlIdentifiers.isValidTable(table)) {
            throw new SubscriptionConfigurationException("Invalid table name '" + table + "'");
        }
        List<ColumnInfo> columns = tableRowSource.describeColumns(table);
        if (columns.isEmpty()) {
            throw new SubscriptionConfigurationException("Table '" + table + "' not found in service '" + serviceName + "'");
        }
        Set<String> columnNames = new LinkedHashSet<>();
        columns.forEach(c -> columnNames.add(c.name()));

        TriggerMode mode = definition.getTriggerMode() != null ? definition.getTriggerMode() : TriggerMode.NEW_ROW;
        String configuredColumn = mode == TriggerMode.NEW_ROW ? definition.getDateColumn() : definition.getMonitorColumn();
        String watermark = timestampColumnResolver.resolve(table, configuredColumn, columns);

        String keyColumn = columnNames.stream()
                .filter(c -> c.equalsIgnoreCase(definition.getKeyColumn()))
                .findFirst()
                .orElse(definition.getKeyColumn());

        CleanupStrategyType cleanup = definition.getCleanupStrategy();
        if (!definition.isCdcMode() && cleanup == CleanupStrategyType.PROCESSED_MARKER) {
            log.warn("⚠️ {} requests processed-marker cleanup outside CDC mode, using time-based", table);
            cleanup = CleanupStrategyType.TIME_BASED;
        }
        if (cleanup == CleanupStrategyType.PROCESSED_MARKER
                && columnNames.stream().noneMatch(c -> c.equalsIgnoreCase(PROCESSED_COLUMN))) {
            throw new SubscriptionConfigurationException(
                    "Processed-marker cleanup needs a '" + PROCESSED_COLUMN + "' column on " + table);
        }

        int batchSize = definition.getBatchSize() != null
                ? definition.getBatchSize()
                : definition.isCdcMode() ? properties.getBatch().getCdcSize() : properties.getBatch().getStandardSize();

        RealtimeProperties.Intervals defaults = properties.getIntervals();
        TableDescriptor descriptor;
        try {
            descriptor = new TableDescriptor(serviceName, entityName, table, mode, watermark, keyColumn,
                    definition.getTimezoneOffsetMinutes(), definition.isCdcMode(), batchSize, cleanup,
                    orDefault(definition.getMinInterval(), defaults.getMin()),
                    orDefault(definition.getBaseInterval(), defaults.getBase()),
                    orDefault(definition.getMaxInterval(), defaults.getMax()),
                    columnNames);
        } catch (IllegalArgumentException e) {
            throw new SubscriptionConfigurationException(e.getMessage(), e);
        }
        log.info("📋 Resolved {}/{} -> table {} ({} on {}, batch {}, {})", serviceName, entityName, table,
                mode.getCode(), watermark, batchSize, cleanup.getCode());
        return descriptor;
    }

    private static long orDefault(Long value, long fallback) {
        return value != null ? value : fallback;
    }
}
