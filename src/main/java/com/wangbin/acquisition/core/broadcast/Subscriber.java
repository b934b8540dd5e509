package com.wangbin.acquisition.core.broadcast;

import lombok.Getter;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 订阅者：连接、已订阅频道与最近心跳时间
 */
@Getter
public class Subscriber {

    private final SubscriberConnection connection;
    private final long connectedAt;
    private final Set<String> channels = ConcurrentHashMap.newKeySet();
    private volatile long lastHeartbeat;

    public Subscriber(SubscriberConnection connection, long connectedAt) {
        this.connection = connection;
        this.connectedAt = connectedAt;
        this.lastHeartbeat = connectedAt;
    }

    public String getId() {
        return connection.getId();
    }

    public Set<String> getChannels() {
        return Collections.unmodifiableSet(channels);
    }

    boolean addChannel(String channel) {
        return channels.add(channel);
    }

    boolean removeChannel(String channel) {
        return channels.remove(channel);
    }

    public boolean isSubscribed(String channel) {
        return channels.contains(channel);
    }

    void refreshHeartbeat(long now) {
        this.lastHeartbeat = now;
    }

    /**
     * 严格大于超时时间才算过期
     */
    public boolean isExpired(long now, long timeoutMs) {
        return now - lastHeartbeat > timeoutMs;
    }
}
