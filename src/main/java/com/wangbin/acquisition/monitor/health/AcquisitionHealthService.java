package com.wangbin.acquisition.monitor.health;

import com.wangbin.acquisition.common.domain.enums.ConnectionStatus;
import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.batch.BatchWriterStats;
import com.wangbin.acquisition.core.broadcast.BroadcastHub;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.lifecycle.AcquisitionLifecycle;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.link.DeviceLinkStatus;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.overflow.OverflowStats;
import com.wangbin.acquisition.core.poll.PollState;
import com.wangbin.acquisition.core.poll.PollScheduler;
import com.wangbin.acquisition.core.poll.PollStats;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 汇总采集链路各组件的健康信息，供运维判断降级状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcquisitionHealthService {

    private final AcquisitionProperties properties;
    private final AcquisitionLifecycle lifecycle;
    private final DeviceLink deviceLink;
    private final PollScheduler pollScheduler;
    private final SnapshotStore snapshotStore;
    private final BatchWriter batchWriter;
    private final OverflowCache overflowCache;
    private final TimeSeriesStore timeSeriesStore;
    private final BroadcastHub broadcastHub;

    public PipelineHealth getSystemHealth() {
        List<ComponentHealth> checks = new ArrayList<>();
        checks.add(buildPlcHealth());
        checks.add(buildPollingHealth());
        checks.add(buildStoreHealth());
        checks.add(buildOverflowHealth());
        checks.add(ComponentHealth.up("broadcast", "实时推送")
                .detail("stats", broadcastHub.getStats()));

        return PipelineHealth.of(lifecycle.isStarted(), properties.isMockMode() ? "mock" : "plc",
                checks, System.currentTimeMillis());
    }

    public DeviceLinkStatus getPlcStatus() {
        return deviceLink.getStatus();
    }

    public Map<String, Object> getPollingStatus() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("lifecycleStarted", lifecycle.isStarted());
        result.put("poll", pollScheduler.getStats());
        result.put("batch", batchWriter.getStats());
        result.put("snapshotSize", snapshotStore.size());
        result.put("latestTimestamp", snapshotStore.getLatestTimestamp());
        return result;
    }

    /**
     * 运维触发重连，由采集线程在下一周期执行
     */
    public void requestReconnect() {
        deviceLink.requestReconnect();
    }

    private ComponentHealth buildPlcHealth() {
        DeviceLinkStatus status = deviceLink.getStatus();
        HealthLevel level;
        if (!lifecycle.isStarted()) {
            level = HealthLevel.NOT_STARTED;
        } else if (status.getStatus() == ConnectionStatus.CONNECTED && status.isHealthy()) {
            level = HealthLevel.UP;
        } else if (status.getStatus() == ConnectionStatus.DISCONNECTED) {
            level = HealthLevel.DOWN;
        } else {
            level = HealthLevel.DEGRADED;
        }
        return ComponentHealth.of("plc", level, status.getEndpoint())
                .detail("link", status);
    }

    private ComponentHealth buildPollingHealth() {
        PollStats stats = pollScheduler.getStats();
        PollState outcome = stats.getLastOutcome();
        HealthLevel level;
        if (outcome == null) {
            level = HealthLevel.NOT_STARTED;
        } else if (outcome == PollState.SUCCESS) {
            level = HealthLevel.UP;
        } else if (outcome == PollState.PARTIAL_FAILURE) {
            level = HealthLevel.DEGRADED;
        } else {
            level = HealthLevel.DOWN;
        }
        return ComponentHealth.of("polling", level, "最近周期: " + outcome)
                .detail("poll", stats);
    }

    private ComponentHealth buildStoreHealth() {
        BatchWriterStats batchStats = batchWriter.getStats();
        boolean reachable;
        try {
            reachable = timeSeriesStore.isHealthy();
        } catch (Exception e) {
            log.warn("时序库健康检查异常", e);
            reachable = false;
        }
        // 时序库不可用时数据转入溢出缓存，属于降级而非宕机
        ComponentHealth health = reachable
                ? ComponentHealth.up("store", "时序库可用")
                : ComponentHealth.degraded("store", "时序库不可用，写入转入溢出缓存");
        return health.detail("reachable", reachable)
                .detail("lastFlushTime", batchStats.getLastFlushTime())
                .detail("batch", batchStats);
    }

    private ComponentHealth buildOverflowHealth() {
        try {
            OverflowStats stats = overflowCache.getStats();
            String summary = "待重放 " + stats.getDepth() + " 条";
            ComponentHealth health = stats.getDepth() == 0
                    ? ComponentHealth.up("overflow", summary)
                    : ComponentHealth.degraded("overflow", summary);
            return health.detail("cache", stats);
        } catch (Exception e) {
            log.warn("获取溢出缓存状态失败", e);
            return ComponentHealth.degraded("overflow", "读取溢出缓存失败: " + e.getMessage());
        }
    }
}
