package com.wangbin.acquisition.monitor.health;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 链路中单个组件（plc、polling、store、overflow、broadcast）的检查结果
 */
@Getter
public class ComponentHealth {

    private final String name;
    private final HealthLevel level;
    private final String summary;
    private final Map<String, Object> details = new LinkedHashMap<>();

    private ComponentHealth(String name, HealthLevel level, String summary) {
        this.name = name;
        this.level = level;
        this.summary = summary;
    }

    public static ComponentHealth of(String name, HealthLevel level, String summary) {
        return new ComponentHealth(name, level, summary);
    }

    public static ComponentHealth up(String name, String summary) {
        return new ComponentHealth(name, HealthLevel.UP, summary);
    }

    public static ComponentHealth degraded(String name, String summary) {
        return new ComponentHealth(name, HealthLevel.DEGRADED, summary);
    }

    public ComponentHealth detail(String key, Object value) {
        details.put(key, value);
        return this;
    }
}
