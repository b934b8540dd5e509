package com.wangbin.acquisition.core.broadcast;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class BroadcastStats {

    private int totalConnections;
    private Map<String, Integer> channelSubscribers;
    private long pushCount;
    private long reapedCount;
    private long sendFailures;
    private long heartbeatTimeoutMs;
}
