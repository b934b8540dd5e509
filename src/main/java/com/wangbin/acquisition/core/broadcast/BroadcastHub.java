package com.wangbin.acquisition.core.broadcast;

import com.alibaba.fastjson2.JSONObject;
import com.wangbin.acquisition.common.constant.AcquisitionConstant;
import com.wangbin.acquisition.common.domain.entity.Reading;
import com.wangbin.acquisition.common.utils.JsonUtil;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 实时推送中心：维护订阅者、清理心跳超时连接、定时推送最新快照。
 * <p>
 * 发送都在锁外进行，单个订阅者发送失败只移除该订阅者。
 */
@Slf4j
public class BroadcastHub {

    private final SnapshotStore snapshotStore;
    private final AcquisitionProperties.Broadcast config;
    private final LongSupplier clock;
    private final String source;
    private final Set<String> allowedChannels;
    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    private final AtomicLong pushCount = new AtomicLong(0);
    private final AtomicLong reapedCount = new AtomicLong(0);
    private final AtomicLong sendFailures = new AtomicLong(0);

    public BroadcastHub(SnapshotStore snapshotStore, AcquisitionProperties.Broadcast config,
                        LongSupplier clock, boolean mockMode) {
        this.snapshotStore = snapshotStore;
        this.config = config;
        this.clock = clock;
        this.source = mockMode ? AcquisitionConstant.SOURCE_MOCK : AcquisitionConstant.SOURCE_PLC;
        this.allowedChannels = new LinkedHashSet<>(config.getChannels());
    }

    public Subscriber register(SubscriberConnection connection) {
        Subscriber subscriber = new Subscriber(connection, clock.getAsLong());
        subscribers.put(connection.getId(), subscriber);
        log.info("[WS] 新连接 {}，当前连接数 {}", connection.getId(), subscribers.size());
        return subscriber;
    }

    /**
     * 订阅频道，频道不在允许列表中返回 false
     */
    public boolean subscribe(String connectionId, String channel) {
        Subscriber subscriber = subscribers.get(connectionId);
        if (subscriber == null || channel == null || !allowedChannels.contains(channel)) {
            return false;
        }
        subscriber.addChannel(channel);
        log.info("[WS] 连接 {} 订阅频道 {}", connectionId, channel);
        return true;
    }

    public boolean unsubscribe(String connectionId, String channel) {
        Subscriber subscriber = subscribers.get(connectionId);
        if (subscriber == null || channel == null) {
            return false;
        }
        boolean removed = subscriber.removeChannel(channel);
        if (removed) {
            log.info("[WS] 连接 {} 取消订阅 {}", connectionId, channel);
        }
        return removed;
    }

    /**
     * 刷新心跳时间，不改变订阅状态
     */
    public boolean heartbeat(String connectionId) {
        Subscriber subscriber = subscribers.get(connectionId);
        if (subscriber == null) {
            return false;
        }
        subscriber.refreshHeartbeat(clock.getAsLong());
        return true;
    }

    /**
     * 移除并关闭连接，可重复调用
     */
    public boolean remove(String connectionId) {
        Subscriber subscriber = subscribers.remove(connectionId);
        if (subscriber == null) {
            return false;
        }
        if (subscriber.getConnection().isOpen()) {
            subscriber.getConnection().close();
        }
        log.info("[WS] 连接 {} 已移除，当前连接数 {}", connectionId, subscribers.size());
        return true;
    }

    /**
     * 处理客户端报文
     */
    public void handleMessage(String connectionId, String text) {
        JSONObject message = JsonUtil.parseObjectQuietly(text);
        if (message == null) {
            sendError(connectionId, AcquisitionConstant.ERROR_INVALID_MESSAGE, "无效的 JSON 消息格式");
            return;
        }
        String type = message.getString("type");
        String channel = message.getString("channel");
        if (AcquisitionConstant.MESSAGE_TYPE_SUBSCRIBE.equals(type)) {
            if (!subscribe(connectionId, channel)) {
                sendError(connectionId, AcquisitionConstant.ERROR_INVALID_CHANNEL, "无效的频道: " + channel);
            }
        } else if (AcquisitionConstant.MESSAGE_TYPE_UNSUBSCRIBE.equals(type)) {
            unsubscribe(connectionId, channel);
        } else if (AcquisitionConstant.MESSAGE_TYPE_HEARTBEAT.equals(type)) {
            heartbeat(connectionId);
            Map<String, Object> echo = new LinkedHashMap<>();
            echo.put("type", AcquisitionConstant.MESSAGE_TYPE_HEARTBEAT);
            echo.put("timestamp", Instant.ofEpochMilli(clock.getAsLong()).toString());
            sendTo(connectionId, JsonUtil.toJsonString(echo));
        } else {
            log.warn("[WS] 未知消息类型: {}", type);
            sendError(connectionId, AcquisitionConstant.ERROR_INVALID_MESSAGE, "未知的消息类型: " + type);
        }
    }

    /**
     * 移除心跳超时或已断开的连接
     *
     * @return 移除数量
     */
    public int reapExpired() {
        long now = clock.getAsLong();
        List<String> expired = new ArrayList<>();
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.isExpired(now, config.getHeartbeatTimeoutMs())) {
                log.warn("[WS] 连接 {} 心跳超时 ({}ms)，断开连接",
                        subscriber.getId(), now - subscriber.getLastHeartbeat());
                expired.add(subscriber.getId());
            } else if (!subscriber.getConnection().isOpen()) {
                log.warn("[WS] 清理已断开的连接 {}", subscriber.getId());
                expired.add(subscriber.getId());
            }
        }
        int removed = 0;
        for (String id : expired) {
            if (remove(id)) {
                removed++;
            }
        }
        reapedCount.addAndGet(removed);
        return removed;
    }

    /**
     * 推送最新快照给 realtime 频道订阅者
     *
     * @return 成功发送的订阅者数量
     */
    public int pushRealtime() {
        List<Subscriber> targets = subscribersOf(AcquisitionConstant.CHANNEL_REALTIME);
        if (targets.isEmpty()) {
            return 0;
        }
        Map<String, Reading> snapshot = snapshotStore.getAll();
        if (snapshot.isEmpty()) {
            log.debug("[WS] 快照为空，跳过推送");
            return 0;
        }
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", AcquisitionConstant.MESSAGE_TYPE_REALTIME_DATA);
        message.put("success", true);
        message.put("timestamp", Instant.ofEpochMilli(clock.getAsLong()).toString());
        message.put("source", source);
        message.put("data", snapshot);
        String payload = JsonUtil.toJsonString(message);

        int sent = 0;
        for (Subscriber subscriber : targets) {
            if (send(subscriber, payload)) {
                sent++;
            }
        }
        long count = pushCount.incrementAndGet();
        if (config.getSummaryEveryPushes() > 0 && count % config.getSummaryEveryPushes() == 0) {
            log.info("[WS] 推送统计: 第 {} 次，订阅者 {}，设备 {}，source={}",
                    count, sent, snapshot.keySet(), source);
        }
        return sent;
    }

    public int getConnectionCount() {
        return subscribers.size();
    }

    public int getChannelSubscribers(String channel) {
        return subscribersOf(channel).size();
    }

    public Set<String> getAllowedChannels() {
        return allowedChannels;
    }

    public BroadcastStats getStats() {
        Map<String, Integer> channels = new LinkedHashMap<>();
        for (String channel : allowedChannels) {
            channels.put(channel, getChannelSubscribers(channel));
        }
        return BroadcastStats.builder()
                .totalConnections(subscribers.size())
                .channelSubscribers(channels)
                .pushCount(pushCount.get())
                .reapedCount(reapedCount.get())
                .sendFailures(sendFailures.get())
                .heartbeatTimeoutMs(config.getHeartbeatTimeoutMs())
                .build();
    }

    /**
     * 关闭全部连接，停机时调用
     */
    public void closeAll() {
        for (String id : new ArrayList<>(subscribers.keySet())) {
            remove(id);
        }
    }

    private List<Subscriber> subscribersOf(String channel) {
        List<Subscriber> result = new ArrayList<>();
        for (Subscriber subscriber : subscribers.values()) {
            if (subscriber.isSubscribed(channel)) {
                result.add(subscriber);
            }
        }
        return result;
    }

    private void sendError(String connectionId, String code, String text) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", AcquisitionConstant.MESSAGE_TYPE_ERROR);
        error.put("code", code);
        error.put("message", text);
        sendTo(connectionId, JsonUtil.toJsonString(error));
    }

    private void sendTo(String connectionId, String payload) {
        Subscriber subscriber = subscribers.get(connectionId);
        if (subscriber != null) {
            send(subscriber, payload);
        }
    }

    private boolean send(Subscriber subscriber, String payload) {
        try {
            subscriber.getConnection().send(payload);
            return true;
        } catch (IOException | RuntimeException e) {
            sendFailures.incrementAndGet();
            log.warn("[WS] 发送失败，移除连接 {}: {}", subscriber.getId(), e.getMessage());
            remove(subscriber.getId());
            return false;
        }
    }
}
