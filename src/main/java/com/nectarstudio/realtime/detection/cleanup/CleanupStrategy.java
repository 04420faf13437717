package com.nectarstudio.realtime.detection.cleanup;

import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.source.RowPredicate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Decides which rows a poll selects and what happens to them once they were delivered.
 * Implementations are Spring beans looked up by {@link #type()}.
 */
public interface CleanupStrategy {

    CleanupStrategyType type();

    /**
     * Selection predicate for the next poll given the current cursor (UTC).
     */
    RowPredicate selection(TableDescriptor table, Instant cursor);

    /**
     * Runs after the batch reached every channel and before the cursor is advanced.
     */
    void afterDelivery(TableDescriptor table, List<Map<String, Object>> rows);

    /**
     * True when {@link #afterDelivery} changes state shared by every view of the table. A poll
     * then selects without the view's filter and its batch refreshes every job on the table.
     */
    default boolean tableScoped() {
        return false;
    }
}
