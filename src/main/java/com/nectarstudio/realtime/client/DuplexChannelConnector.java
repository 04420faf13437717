package com.nectarstudio.realtime.client;

import com.nectarstudio.realtime.transport.DuplexChannel;

import java.net.URI;
import java.util.Map;

/**
 * Opens client connections to a realtime endpoint.
 */
public interface DuplexChannelConnector {

    /**
     * @throws com.nectarstudio.realtime.exception.TransportException when the connection cannot be established
     */
    DuplexChannel connect(URI uri, Map<String, String> headers);
}
