package com.nectarstudio.realtime.transport;

import java.util.function.Consumer;

/**
 * A bidirectional text connection, one per client connection. Channels of the realtime
 * protocol are multiplexed over it.
 */
public interface DuplexChannel {

    /**
     * Identifier of the connection, unique per process.
     */
    String id();

    /**
     * Writes one frame.
     *
     * @throws com.nectarstudio.realtime.exception.TransportException when the connection is closed or the write fails
     */
    void send(String message);

    /**
     * Registers the handler for inbound frames. Replaces any previous handler.
     */
    void onMessage(Consumer<String> handler);

    /**
     * Registers a callback run once when the connection closes, from either side.
     */
    void onClose(Runnable callback);

    void close();

    boolean isOpen();
}
