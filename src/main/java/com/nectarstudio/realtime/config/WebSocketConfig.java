package com.nectarstudio.realtime.config;

import com.nectarstudio.realtime.transport.RealtimeSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeSocketHandler realtimeSocketHandler;
    private final RealtimeProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("🌐 Realtime WebSocket endpoint at {}", properties.getSocketPath());
        registry.addHandler(realtimeSocketHandler, properties.getSocketPath())
                .setAllowedOriginPatterns(properties.getAllowedOriginPatterns().toArray(String[]::new));
    }
}
