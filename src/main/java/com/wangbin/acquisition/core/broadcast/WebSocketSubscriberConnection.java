package com.wangbin.acquisition.core.broadcast;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;

/**
 * Spring WebSocket 会话适配
 * <p>
 * 推送线程与心跳回复可能同时发送，会话经 {@link ConcurrentWebSocketSessionDecorator} 串行化；
 * 慢客户端超过发送时限或缓冲上限时抛出 SessionLimitExceededException，由 BroadcastHub 移除连接。
 */
@Slf4j
public class WebSocketSubscriberConnection implements SubscriberConnection {

    private final WebSocketSession session;

    public WebSocketSubscriberConnection(WebSocketSession session, int sendTimeLimitMs, int sendBufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public void send(String message) throws IOException {
        session.sendMessage(new TextMessage(message));
    }

    @Override
    public void close() {
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("[WS] 关闭连接 {} 异常: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }
}
