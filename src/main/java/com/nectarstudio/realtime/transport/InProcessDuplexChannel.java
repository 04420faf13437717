package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.exception.TransportException;

/**
 * One end of an in-memory connection. Frames are handed to the peer's handler on the
 * sending thread. Used to embed a client in the same JVM and in tests.
 */
public class InProcessDuplexChannel extends AbstractDuplexChannel {

    private InProcessDuplexChannel peer;

    private InProcessDuplexChannel(String id) {
        super(id);
    }

    /**
     * Creates two connected ends; index 0 is the server side, index 1 the client side.
     */
    public static InProcessDuplexChannel[] pair(String connectionId) {
        InProcessDuplexChannel server = new InProcessDuplexChannel(connectionId);
        InProcessDuplexChannel client = new InProcessDuplexChannel(connectionId);
        server.peer = client;
        client.peer = server;
        return new InProcessDuplexChannel[]{server, client};
    }

    @Override
    public void send(String message) {
        if (!isOpen()) {
            throw new TransportException("Connection " + id() + " is closed");
        }
        peer.dispatchMessage(message);
    }

    @Override
    public void close() {
        dispatchClose();
        peer.dispatchClose();
    }
}
