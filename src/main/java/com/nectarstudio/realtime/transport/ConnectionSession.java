package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.registry.ChannelRef;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Server-side view of one client connection: its outboxes and channel states, keyed by channel id.
 */
public class ConnectionSession {

    private final DuplexChannel connection;
    private final Instant connectedAt;
    private final Map<String, ChannelOutbox> outboxes = new ConcurrentHashMap<>();
    private final Map<String, ChannelState> states = new ConcurrentHashMap<>();

    public ConnectionSession(DuplexChannel connection, Instant connectedAt) {
        this.connection = connection;
        this.connectedAt = connectedAt;
    }

    public String connectionId() {
        return connection.id();
    }

    public DuplexChannel connection() {
        return connection;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public ChannelRef channel(String channelId) {
        return new ChannelRef(connection.id(), channelId);
    }

    public Optional<ChannelOutbox> outbox(String channelId) {
        return Optional.ofNullable(outboxes.get(channelId));
    }

    /**
     * Installs a new outbox for the channel and returns the one it replaced, if any.
     */
    public Optional<ChannelOutbox> replaceOutbox(String channelId, ChannelOutbox outbox) {
        return Optional.ofNullable(outboxes.put(channelId, outbox));
    }

    public Optional<ChannelOutbox> removeOutbox(String channelId) {
        return Optional.ofNullable(outboxes.remove(channelId));
    }

    public Map<String, ChannelOutbox> outboxes() {
        return outboxes;
    }

    public Optional<ChannelState> state(String channelId) {
        return Optional.ofNullable(states.get(channelId));
    }

    public void setState(String channelId, ChannelState state) {
        states.put(channelId, state);
    }

    public Map<String, ChannelState> states() {
        return Map.copyOf(states);
    }
}
