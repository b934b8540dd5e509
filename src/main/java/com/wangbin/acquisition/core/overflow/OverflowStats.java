package com.wangbin.acquisition.core.overflow;

import lombok.Builder;
import lombok.Data;

/**
 * 溢出缓存统计
 */
@Data
@Builder
public class OverflowStats {

    private long depth;
    private long maxRecords;
    private OverflowEvictionPolicy evictionPolicy;
    private long enqueued;
    private long replayed;
    private long evicted;
    private long failedPasses;
    private long lastReplayTime;
}
