package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.nectarstudio.realtime.model.domain.UpdateType;

import java.time.Instant;

/**
 * Server push for one channel.
 * {@code data} is the full snapshot (a list of rows) for {@code polling_refresh}
 * and a single row for {@code database_trigger}; {@code operation} is only set for the latter.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableUpdate(
        String channelId,
        String serviceName,
        String entityName,
        UpdateType updateType,
        Object data,
        String operation,
        Integer changeCount,
        Long total,
        Instant timestamp
) {

    public TableUpdate withChannelId(String otherChannelId) {
        return new TableUpdate(otherChannelId, serviceName, entityName, updateType, data,
                operation, changeCount, total, timestamp);
    }

    public boolean isRefresh() {
        return updateType == UpdateType.POLLING_REFRESH;
    }
}
