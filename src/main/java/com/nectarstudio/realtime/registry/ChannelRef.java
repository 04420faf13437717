package com.nectarstudio.realtime.registry;

import java.util.Objects;

/**
 * A subscriber channel. Channel ids are chosen by clients, so they are only unique
 * within one connection.
 */
public record ChannelRef(String connectionId, String channelId) {

    public ChannelRef {
        Objects.requireNonNull(connectionId, "connectionId");
        Objects.requireNonNull(channelId, "channelId");
    }

    @Override
    public String toString() {
        return connectionId + "#" + channelId;
    }
}
