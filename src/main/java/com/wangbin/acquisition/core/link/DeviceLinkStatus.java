package com.wangbin.acquisition.core.link;

import com.wangbin.acquisition.common.domain.enums.ConnectionStatus;
import lombok.Builder;
import lombok.Data;

/**
 * 设备链路状态快照
 */
@Data
@Builder
public class DeviceLinkStatus {

    private String endpoint;
    private ConnectionStatus status;
    private boolean healthy;
    private int consecutiveErrors;
    private int errorThreshold;
    private long totalConnects;
    private long totalReads;
    private long failedReads;
    private String lastError;
    private long lastConnectTime;
    private long lastReadTime;
    private boolean reconnectRequested;
}
