package com.nectarstudio.realtime.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nectarstudio.realtime.exception.MalformedMessageException;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Encodes and decodes the JSON envelope {@code {"event": <type>, "data": {...}}}.
 */
@Component
public class RealtimeMessageCodec {

    private final ObjectMapper objectMapper;

    public RealtimeMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Codec with its own mapper, for clients running outside a Spring context.
     */
    public static RealtimeMessageCodec standalone() {
        return new RealtimeMessageCodec(JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build());
    }

    public String encode(String event, Object payload) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("event", event);
        envelope.set("data", payload == null ? NullNode.getInstance() : objectMapper.valueToTree(payload));
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode '" + event + "' message", e);
        }
    }

    /**
     * MD5 hex of the JSON form of {@code value}. Equal content gives equal checksums.
     */
    public String checksum(Object value) {
        try {
            return DigestUtils.md5DigestAsHex(objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot checksum " + value.getClass().getSimpleName(), e);
        }
    }

    public RealtimeMessage decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !root.path("event").isTextual()) {
            throw new MalformedMessageException("Frame has no 'event' field", null);
        }
        return new RealtimeMessage(root.get("event").asText(), root.path("data"));
    }

    /**
     * Binds the data of a frame to a payload type.
     */
    public <T> T payload(RealtimeMessage message, Class<T> type) {
        try {
            return objectMapper.treeToValue(message.data(), type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid '" + message.event() + "' payload: " + e.getMessage(), e);
        }
    }
}
