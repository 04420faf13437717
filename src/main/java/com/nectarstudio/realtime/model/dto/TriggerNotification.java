package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Row change published by a source-side trigger relay (for example a
 * {@code pg_notify} bridge) onto the trigger topic.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriggerNotification {

    @JsonProperty("service")
    private String serviceName;

    @JsonProperty("table")
    private String entityName;

    @JsonProperty("operation")
    private String operation; // TG_OP: INSERT, UPDATE or DELETE

    @JsonProperty("data")
    private Map<String, Object> data;

    @JsonProperty("timestamp")
    private Double timestamp; // epoch seconds, fractional

    /**
     * Event time in UTC, or the given fallback when the relay did not send one.
     */
    public Instant occurredAt(Instant fallback) {
        if (timestamp == null) {
            return fallback;
        }
        return Instant.ofEpochMilli(Math.round(timestamp * 1000));
    }

    public boolean hasPayload() {
        return serviceName != null && entityName != null && data != null;
    }
}
