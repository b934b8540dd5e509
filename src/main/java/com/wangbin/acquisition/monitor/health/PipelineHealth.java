package com.wangbin.acquisition.monitor.health;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 采集链路整体健康状态
 * <p>
 * plc 与 polling 决定能否采集，任一 DOWN 即整体 DOWN；其余组件异常只会让链路降级，
 * 因为时序库不可用时数据仍会进入溢出缓存。
 */
@Getter
public class PipelineHealth {

    static final Set<String> CRITICAL_COMPONENTS = Set.of("plc", "polling");

    private final HealthLevel status;
    private final long timestamp;
    /** 数据来源：plc / mock */
    private final String source;
    private final boolean lifecycleStarted;
    private final Map<String, ComponentHealth> components;
    private final List<String> degradedComponents;

    private PipelineHealth(HealthLevel status, long timestamp, String source, boolean lifecycleStarted,
                           Map<String, ComponentHealth> components, List<String> degradedComponents) {
        this.status = status;
        this.timestamp = timestamp;
        this.source = source;
        this.lifecycleStarted = lifecycleStarted;
        this.components = components;
        this.degradedComponents = degradedComponents;
    }

    public static PipelineHealth of(boolean lifecycleStarted, String source, List<ComponentHealth> checks,
                                    long timestamp) {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        List<String> degraded = new ArrayList<>();
        boolean criticalDown = false;
        for (ComponentHealth check : checks) {
            components.put(check.getName(), check);
            HealthLevel level = check.getLevel();
            if (level == HealthLevel.DEGRADED || level == HealthLevel.DOWN) {
                degraded.add(check.getName());
            }
            if (level == HealthLevel.DOWN && CRITICAL_COMPONENTS.contains(check.getName())) {
                criticalDown = true;
            }
        }
        HealthLevel status;
        if (!lifecycleStarted) {
            status = HealthLevel.NOT_STARTED;
        } else if (criticalDown) {
            status = HealthLevel.DOWN;
        } else if (!degraded.isEmpty()) {
            status = HealthLevel.DEGRADED;
        } else {
            status = HealthLevel.UP;
        }
        return new PipelineHealth(status, timestamp, source, lifecycleStarted,
                Collections.unmodifiableMap(components), Collections.unmodifiableList(degraded));
    }
}
