package com.nectarstudio.realtime.detection.cleanup;

import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.source.RowPredicate;
import com.nectarstudio.realtime.source.TableRowSource;
import com.nectarstudio.realtime.util.RecordKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CDC mode: selects every row not yet flagged in the {@code processed} column and flags the
 * delivered ones. Selection ignores the cursor, so rows that arrive late with an older
 * timestamp are still picked up. The flag belongs to the row, not to a view, so the
 * strategy is {@linkplain #tableScoped() table scoped}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessedMarkerCleanup implements CleanupStrategy {

    private final TableRowSource tableRowSource;

    @Override
    public CleanupStrategyType type() {
        return CleanupStrategyType.PROCESSED_MARKER;
    }

    @Override
    public RowPredicate selection(TableDescriptor table, Instant cursor) {
        return RowPredicate.of("processed IS NULL OR processed = 0");
    }

    @Override
    public boolean tableScoped() {
        return true;
    }

    @Override
    public void afterDelivery(TableDescriptor table, List<Map<String, Object>> rows) {
        List<Object> ids = rows.stream()
                .map(row -> RecordKeys.valueOf(row, table.keyColumn()))
                .filter(Objects::nonNull)
                .toList();
        if (ids.size() < rows.size()) {
            log.warn("{} of {} delivered rows in {} have no '{}' value and cannot be marked",
                    rows.size() - ids.size(), rows.size(), table.table(), table.keyColumn());
        }
        if (!ids.isEmpty()) {
            tableRowSource.markProcessed(table.table(), table.keyColumn(), ids);
        }
    }
}
