package com.wangbin.acquisition.common.config;

import com.wangbin.acquisition.core.broadcast.RealtimeWebSocketHandler;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler realtimeWebSocketHandler;
    private final AcquisitionProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(realtimeWebSocketHandler, properties.getBroadcast().getPath())
                .setAllowedOriginPatterns(properties.getBroadcast().getAllowedOrigins());
    }
}
