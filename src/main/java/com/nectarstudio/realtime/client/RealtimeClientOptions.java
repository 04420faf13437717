package com.nectarstudio.realtime.client;

import com.nectarstudio.realtime.model.dto.TableFilters;
import lombok.Data;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of one {@link RealtimeTableClient}. Credentials and organisation context are passed
 * here explicitly and sent as headers on both the snapshot request and the socket handshake.
 */
@Data
public class RealtimeClientOptions {

    private TableFilters filters = TableFilters.none();
    private long pollingInterval = 5000;
    private boolean enableDatabaseTriggers = false;
    // false keeps the client on the initial snapshot plus manual refetch
    private boolean enabled = true;

    private String apiKey;
    private String organizationId;
    private Map<String, String> headers = new LinkedHashMap<>();
    private Duration connectTimeout = Duration.ofSeconds(10);

    public Map<String, String> requestHeaders() {
        Map<String, String> all = new LinkedHashMap<>(headers);
        if (apiKey != null) {
            all.put("X-API-Key", apiKey);
        }
        if (organizationId != null) {
            all.put("X-Organization-Id", organizationId);
        }
        return all;
    }
}
