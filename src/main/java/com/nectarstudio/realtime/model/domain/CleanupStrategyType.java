package com.nectarstudio.realtime.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CleanupStrategyType {
    TIME_BASED("time-based"),
    PROCESSED_MARKER("processed-marker");

    private final String code;

    CleanupStrategyType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static CleanupStrategyType fromCode(String code) {
        for (CleanupStrategyType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown cleanup strategy: " + code);
    }
}
