package com.wangbin.acquisition.core.broadcast;

import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebSocketSubscriberConnectionTest {

    @Test
    void sendsTextFrameThroughSession() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-1");
        when(session.isOpen()).thenReturn(true);
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection(session, 5000, 1024);

        connection.send("{\"type\":\"realtime\"}");

        verify(session).sendMessage(new TextMessage("{\"type\":\"realtime\"}"));
        assertEquals("ws-1", connection.getId());
        assertTrue(connection.isOpen());
    }

    @Test
    void slowClientExceedingBufferLimitIsRejected() throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn("ws-slow");
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            sending.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(session).sendMessage(any());
        WebSocketSubscriberConnection connection = new WebSocketSubscriberConnection(session, 5000, 16);

        ExecutorService pushThread = Executors.newSingleThreadExecutor();
        try {
            Future<?> first = pushThread.submit(() -> {
                connection.send("first");
                return null;
            });
            assertTrue(sending.await(5, TimeUnit.SECONDS));

            // 第一条仍在发送中，第二条进入缓冲并超过上限
            assertThrows(SessionLimitExceededException.class, () -> connection.send("x".repeat(64)));

            release.countDown();
            first.get(5, TimeUnit.SECONDS);
            verify(session, times(1)).sendMessage(any());
        } finally {
            release.countDown();
            pushThread.shutdownNow();
        }
    }
}
