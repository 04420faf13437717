package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.service.SubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Server endpoint: adapts each WebSocket session to a {@link DuplexChannel}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RealtimeSocketHandler extends TextWebSocketHandler {

    private static final String CHANNEL_ATTRIBUTE = "realtime.channel";

    private final SubscriptionService subscriptionService;
    private final RealtimeProperties properties;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketDuplexChannel channel = new WebSocketDuplexChannel(session,
                properties.getSendTimeLimitMs(), properties.getSendBufferLimitBytes());
        session.getAttributes().put(CHANNEL_ATTRIBUTE, channel);
        subscriptionService.accept(channel);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketDuplexChannel channel = channelOf(session);
        if (channel != null) {
            channel.dispatchMessage(message.getPayload());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.info("🔌 Transport error on {}: {}", session.getId(), exception.getMessage());
        WebSocketDuplexChannel channel = channelOf(session);
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketDuplexChannel channel = channelOf(session);
        if (channel != null) {
            channel.dispatchClose();
        }
    }

    private static WebSocketDuplexChannel channelOf(WebSocketSession session) {
        return (WebSocketDuplexChannel) session.getAttributes().get(CHANNEL_ATTRIBUTE);
    }
}
