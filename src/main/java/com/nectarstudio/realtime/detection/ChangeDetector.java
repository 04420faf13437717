package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.detection.cleanup.CleanupStrategy;
import com.nectarstudio.realtime.model.domain.ChangeEvent;
import com.nectarstudio.realtime.model.domain.ChangeOperation;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.source.RowPredicate;
import com.nectarstudio.realtime.source.TableRowSource;
import com.nectarstudio.realtime.util.RecordKeys;
import com.nectarstudio.realtime.util.WatermarkValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the rows of a job's table that changed since its cursor.
 * <p>
 * Detection and commit are split: {@link #detect} has no side effects, and {@link #commit}
 * runs the cleanup step and advances the cursor only once the batch has been handed off.
 */
@Slf4j
@Component
public class ChangeDetector {

    private final TableRowSource tableRowSource;
    private final CursorTracker cursorTracker;
    private final Clock clock;
    private final Map<CleanupStrategyType, CleanupStrategy> cleanupStrategies = new EnumMap<>(CleanupStrategyType.class);

    public ChangeDetector(TableRowSource tableRowSource, CursorTracker cursorTracker, Clock clock,
                          List<CleanupStrategy> strategies) {
        this.tableRowSource = tableRowSource;
        this.cursorTracker = cursorTracker;
        this.clock = clock;
        strategies.forEach(strategy -> cleanupStrategies.put(strategy.type(), strategy));
    }

    public CleanupStrategy strategyFor(CleanupStrategyType type) {
        CleanupStrategy strategy = cleanupStrategies.get(type);
        if (strategy == null) {
            throw new IllegalStateException("No cleanup strategy registered for " + type);
        }
        return strategy;
    }

    /**
     * Queries the rows past the job's cursor, oldest first, capped at the table's batch size.
     * Table-scoped strategies select across the whole table, ignoring the job's filter.
     */
    public DetectionResult detect(PollingJob job) {
        TableDescriptor table = job.getTable();
        CleanupStrategy strategy = job.getCleanupStrategy();
        RowPredicate selection = strategy.selection(table, job.getCursor());
        RowPredicate predicate = strategy.tableScoped() ? selection : selection.and(job.getListQuery().where());

        List<Map<String, Object>> rows = tableRowSource.queryRows(
                table.table(), predicate, table.watermarkColumn() + " ASC", table.batchSize());
        if (rows.isEmpty()) {
            return DetectionResult.empty();
        }

        Instant detectedAt = clock.instant();
        ChangeOperation operation = table.triggerMode().reportedOperation();
        List<ChangeEvent> events = new ArrayList<>(rows.size());
        Instant maxCursor = null;
        for (Map<String, Object> row : rows) {
            Instant value = WatermarkValues.toUtc(RecordKeys.valueOf(row, table.watermarkColumn()),
                    table.timezoneOffsetMinutes());
            if (value != null && (maxCursor == null || value.isAfter(maxCursor))) {
                maxCursor = value;
            }
            events.add(new ChangeEvent(operation, row, value, detectedAt));
        }
        if (maxCursor == null) {
            log.warn("⚠️ {} rows from {} carry no readable '{}' value, cursor stays at {}",
                    rows.size(), table.table(), table.watermarkColumn(), job.getCursor());
        }
        log.debug("🔍 {} changes in {} for job {} (cursor {} -> {})",
                events.size(), table.table(), job.getKey(), job.getCursor(), maxCursor);
        return new DetectionResult(events, maxCursor);
    }

    /**
     * Completes a delivered batch: cleanup first, then the cursor.
     */
    public void commit(PollingJob job, DetectionResult result) {
        if (result.isEmpty()) {
            return;
        }
        job.getCleanupStrategy().afterDelivery(job.getTable(), result.rows());
        cursorTracker.advance(job, result.candidateCursor());
    }
}
