package com.nectarstudio.realtime.transport;

/**
 * An encoded frame waiting in a {@link ChannelOutbox}.
 *
 * @param refresh true for a {@code polling_refresh} update, which supersedes everything queued before it
 */
public record OutboundMessage(String event, String frame, boolean refresh) { }
