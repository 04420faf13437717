package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;

import java.util.Set;

/**
 * Fully resolved description of a monitored table: where to read, which column to follow,
 * and the polling bounds that apply to every job on it.
 *
 * @param watermarkColumn the date column in {@link TriggerMode#NEW_ROW} mode, the monitor column otherwise
 * @param columns         every column of the table, used to validate filters
 */
public record TableDescriptor(
        String serviceName,
        String entityName,
        String table,
        TriggerMode triggerMode,
        String watermarkColumn,
        String keyColumn,
        int timezoneOffsetMinutes,
        boolean cdcMode,
        int batchSize,
        CleanupStrategyType cleanupStrategy,
        long minInterval,
        long baseInterval,
        long maxInterval,
        Set<String> columns
) {

    public TableDescriptor {
        if (minInterval <= 0 || minInterval > maxInterval) {
            throw new IllegalArgumentException("Interval bounds must satisfy 0 < min <= max, got ["
                    + minInterval + ", " + maxInterval + "] for " + table);
        }
        baseInterval = Math.max(minInterval, Math.min(maxInterval, baseInterval));
        columns = Set.copyOf(columns);
    }
}
