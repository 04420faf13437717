package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.exception.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * {@link DuplexChannel} over a Spring WebSocket session, used on both the server and the client side.
 * Writes go through {@link ConcurrentWebSocketSessionDecorator}, so concurrent senders are safe and
 * a stalled peer hits the send-time or buffer limit instead of blocking delivery threads.
 */
@Slf4j
public class WebSocketDuplexChannel extends AbstractDuplexChannel {

    private final WebSocketSession session;
    private final WebSocketSession sender;

    public WebSocketDuplexChannel(WebSocketSession session, int sendTimeLimitMillis, int bufferSizeLimit) {
        super(session.getId());
        this.session = session;
        this.sender = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMillis, bufferSizeLimit);
    }

    @Override
    public void send(String message) {
        if (!isOpen() || !session.isOpen()) {
            throw new TransportException("WebSocket " + id() + " is closed");
        }
        try {
            sender.sendMessage(new TextMessage(message));
        } catch (IOException | RuntimeException e) {
            throw new TransportException("Send on WebSocket " + id() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (session.isOpen()) {
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.warn("Error closing WebSocket {}: {}", id(), e.getMessage());
            }
        }
        dispatchClose();
    }
}
