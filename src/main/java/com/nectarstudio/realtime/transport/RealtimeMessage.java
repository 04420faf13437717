package com.nectarstudio.realtime.transport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A decoded protocol frame.
 */
public record RealtimeMessage(String event, JsonNode data) { }
