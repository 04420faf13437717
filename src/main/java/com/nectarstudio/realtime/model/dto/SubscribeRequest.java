package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscribeRequest(
        String serviceName,
        String entityName,
        String channelId,
        TableFilters filters,
        Long pollingInterval,
        Boolean enableDatabaseTriggers
) {

    public TableFilters filtersOrEmpty() {
        return filters != null ? filters : TableFilters.none();
    }

    public boolean triggersRequested() {
        return Boolean.TRUE.equals(enableDatabaseTriggers);
    }
}
