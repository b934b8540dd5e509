package com.wangbin.acquisition.core.broadcast;

import com.wangbin.acquisition.core.config.AcquisitionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * /ws/realtime 端点，报文处理全部委托给 BroadcastHub
 */
@Slf4j
@RequiredArgsConstructor
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    private final BroadcastHub broadcastHub;
    private final AcquisitionProperties.Broadcast config;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        broadcastHub.register(new WebSocketSubscriberConnection(session,
                config.getSendTimeLimitMs(), config.getSendBufferSizeLimit()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("[WS] 收到消息 {}: {}", session.getId(), message.getPayload());
        broadcastHub.handleMessage(session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("[WS] 连接 {} 传输异常: {}", session.getId(), exception.getMessage());
        broadcastHub.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("[WS] 客户端断开 {}: {}", session.getId(), status);
        broadcastHub.remove(session.getId());
    }
}
