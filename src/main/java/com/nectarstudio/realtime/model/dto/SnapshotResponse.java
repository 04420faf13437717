package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Initial list fetch. {@code realtime} is only present when the caller asked for it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SnapshotResponse(List<Map<String, Object>> data, Long total, RealtimeInfo realtime) { }
