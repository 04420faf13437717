package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.source.ColumnInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks the watermark column of a table when none is configured.
 * Known naming patterns win, in configured order; otherwise the first temporal column is used.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TimestampColumnResolver {

    private final RealtimeProperties properties;

    /**
     * @param configured explicitly configured column, may be null
     * @throws SubscriptionConfigurationException when the configured column does not exist
     *                                            or nothing suitable can be found
     */
    public String resolve(String table, String configured, List<ColumnInfo> columns) {
        if (configured != null && !configured.isBlank()) {
            return columns.stream()
                    .map(ColumnInfo::name)
                    .filter(name -> name.equalsIgnoreCase(configured.trim()))
                    .findFirst()
                    .orElseThrow(() -> new SubscriptionConfigurationException(
                            "Column '" + configured + "' does not exist in " + table));
        }

        List<ColumnInfo> temporal = columns.stream().filter(ColumnInfo::isTemporal).toList();
        Optional<String> byPattern = properties.getTimestampColumnPatterns().stream()
                .flatMap(pattern -> temporal.stream()
                        .map(ColumnInfo::name)
                        .filter(name -> name.equalsIgnoreCase(pattern)))
                .findFirst();
        if (byPattern.isPresent()) {
            log.debug("Auto-detected watermark column {} on {}", byPattern.get(), table);
            return byPattern.get();
        }
        if (!temporal.isEmpty()) {
            String fallback = temporal.get(0).name();
            log.info("No well-known timestamp column on {}, falling back to first temporal column {}", table, fallback);
            return fallback;
        }
        throw new SubscriptionConfigurationException("No suitable timestamp column found for table " + table);
    }
}
