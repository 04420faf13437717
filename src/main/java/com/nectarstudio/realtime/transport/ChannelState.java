package com.nectarstudio.realtime.transport;

/**
 * Lifecycle of one subscriber channel.
 * {@code PENDING -> SUBSCRIBED -> (UNSUBSCRIBED | DISCONNECTED)}, or {@code PENDING -> FAILED}.
 */
public enum ChannelState {
    PENDING,
    SUBSCRIBED,
    UNSUBSCRIBED,
    DISCONNECTED,
    FAILED;

    public boolean isTerminal() {
        return this == UNSUBSCRIBED || this == DISCONNECTED || this == FAILED;
    }
}
