package com.nectarstudio.realtime.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Selects which watermark column a polling job follows.
 */
public enum TriggerMode {
    /** Follows a creation date column and reports INSERTs. */
    NEW_ROW("newRow"),
    /** Follows a last-modified column and reports UPDATEs. */
    UPDATED_ROW("updatedRow");

    private final String code;

    TriggerMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public ChangeOperation reportedOperation() {
        return this == NEW_ROW ? ChangeOperation.INSERT : ChangeOperation.UPDATE;
    }

    @JsonCreator
    public static TriggerMode fromCode(String code) {
        for (TriggerMode mode : values()) {
            if (mode.code.equalsIgnoreCase(code) || mode.name().equalsIgnoreCase(code)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown trigger mode: " + code);
    }
}
