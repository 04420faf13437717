package com.nectarstudio.realtime.client;

import com.nectarstudio.realtime.exception.TransportException;
import com.nectarstudio.realtime.transport.DuplexChannel;
import com.nectarstudio.realtime.transport.WebSocketDuplexChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link DuplexChannelConnector} over the JSR-356 WebSocket client.
 */
@Slf4j
public class WebSocketChannelConnector implements DuplexChannelConnector {

    private static final int SEND_TIME_LIMIT_MS = 10000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;

    private final WebSocketClient webSocketClient;
    private final Duration connectTimeout;

    public WebSocketChannelConnector(Duration connectTimeout) {
        this(new StandardWebSocketClient(), connectTimeout);
    }

    public WebSocketChannelConnector(WebSocketClient webSocketClient, Duration connectTimeout) {
        this.webSocketClient = webSocketClient;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public DuplexChannel connect(URI uri, Map<String, String> headers) {
        WebSocketHttpHeaders handshakeHeaders = new WebSocketHttpHeaders();
        headers.forEach(handshakeHeaders::add);
        ClientHandler handler = new ClientHandler();
        try {
            webSocketClient.execute(handler, handshakeHeaders, uri)
                    .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while connecting to " + uri, e);
        } catch (ExecutionException e) {
            throw new TransportException("Cannot connect to " + uri + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out connecting to " + uri, e);
        }
        log.info("🔌 Connected to {}", uri);
        return handler.channel;
    }

    private static class ClientHandler extends TextWebSocketHandler {

        private volatile WebSocketDuplexChannel channel;

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            channel = new WebSocketDuplexChannel(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            channel.dispatchMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            log.info("🔌 Client transport error on {}: {}", session.getId(), exception.getMessage());
            channel.close();
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (channel != null) {
                channel.dispatchClose();
            }
        }
    }
}
