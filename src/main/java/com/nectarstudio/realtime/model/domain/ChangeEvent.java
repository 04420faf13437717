package com.nectarstudio.realtime.model.domain;

import java.time.Instant;
import java.util.Map;

/**
 * One row-level change detected during a poll cycle or received from a source-side trigger.
 *
 * @param operation         INSERT, UPDATE or DELETE
 * @param record            the row as column name to value, keyed by its {@code id} column
 * @param sourceCursorValue watermark value of the row normalised to UTC, null for trigger events
 * @param detectedAt        when the change was observed by this service
 */
public record ChangeEvent(
        ChangeOperation operation,
        Map<String, Object> record,
        Instant sourceCursorValue,
        Instant detectedAt
) { }
