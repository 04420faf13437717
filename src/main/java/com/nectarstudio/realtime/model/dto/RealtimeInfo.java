package com.nectarstudio.realtime.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RealtimeInfo(
        boolean enabled,
        String socketUrl,
        String channelId,
        List<String> supportedMethods,
        String defaultMethod
) {

    public static RealtimeInfo disabled() {
        return new RealtimeInfo(false, null, null, List.of(), null);
    }
}
