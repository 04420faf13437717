package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PollingError(String channelId, String error) { }
