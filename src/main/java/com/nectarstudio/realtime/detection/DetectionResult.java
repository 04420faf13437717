package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.model.domain.ChangeEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of one poll, not yet committed.
 *
 * @param candidateCursor highest watermark among the events in UTC, null when no row carried one
 */
public record DetectionResult(List<ChangeEvent> events, Instant candidateCursor) {

    private static final DetectionResult EMPTY = new DetectionResult(List.of(), null);

    public DetectionResult {
        events = List.copyOf(events);
    }

    public static DetectionResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    public List<Map<String, Object>> rows() {
        return events.stream().map(ChangeEvent::record).toList();
    }
}
