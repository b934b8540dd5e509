package com.wangbin.acquisition.common.domain.entity;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个设备在一个采集周期内的读数，创建后不可变
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Reading {

    private final String deviceId;
    private final String deviceName;
    private final String deviceType;
    private final String moduleType;
    private final int blockId;
    /** 采集时间（毫秒） */
    private final long timestamp;
    private final Map<String, Object> values;

    @Builder
    public Reading(String deviceId, String deviceName, String deviceType, String moduleType,
                   int blockId, long timestamp, Map<String, Object> values) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.deviceType = deviceType;
        this.moduleType = moduleType;
        this.blockId = blockId;
        this.timestamp = timestamp;
        this.values = values == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
