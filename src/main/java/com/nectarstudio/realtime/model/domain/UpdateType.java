package com.nectarstudio.realtime.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UpdateType {
    POLLING_REFRESH("polling_refresh"),
    DATABASE_TRIGGER("database_trigger");

    private final String code;

    UpdateType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static UpdateType fromCode(String code) {
        for (UpdateType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown update type: " + code);
    }
}
