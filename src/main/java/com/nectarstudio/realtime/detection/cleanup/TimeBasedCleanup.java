package com.nectarstudio.realtime.detection.cleanup;

import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.source.RowPredicate;
import com.nectarstudio.realtime.util.WatermarkValues;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rows at or before the cursor are simply never selected again; nothing to clean.
 */
@Component
public class TimeBasedCleanup implements CleanupStrategy {

    static final String CURSOR_PARAM = "cursor";

    @Override
    public CleanupStrategyType type() {
        return CleanupStrategyType.TIME_BASED;
    }

    @Override
    public RowPredicate selection(TableDescriptor table, Instant cursor) {
        return RowPredicate.of(table.watermarkColumn() + " > :" + CURSOR_PARAM, CURSOR_PARAM,
                WatermarkValues.toSourceClock(cursor, table.timezoneOffsetMinutes()));
    }

    @Override
    public void afterDelivery(TableDescriptor table, List<Map<String, Object>> rows) {
        // cursor advance is the cleanup
    }
}
