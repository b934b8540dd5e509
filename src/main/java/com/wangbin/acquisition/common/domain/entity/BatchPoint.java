package com.wangbin.acquisition.common.domain.entity;

import com.alibaba.fastjson2.annotation.JSONField;
import com.wangbin.acquisition.common.constant.AcquisitionConstant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 时序库写入点：measurement + 标签 + 数值字段 + 时间戳
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPoint {

    private String measurement;
    private Map<String, String> tags;
    private Map<String, Object> fields;
    /** 采集时间（毫秒） */
    private long timestamp;

    /**
     * 由读数构建写入点，字符串与空值字段不写入；没有可写字段时返回 null
     */
    public static BatchPoint fromReading(Reading reading, String measurement) {
        Map<String, Object> fields = new LinkedHashMap<>();
        reading.getValues().forEach((name, value) -> {
            if (value instanceof Number || value instanceof Boolean) {
                fields.put(name, value);
            }
        });
        if (fields.isEmpty()) {
            return null;
        }
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put(AcquisitionConstant.TAG_DEVICE_ID, reading.getDeviceId());
        putIfPresent(tags, AcquisitionConstant.TAG_DEVICE_TYPE, reading.getDeviceType());
        putIfPresent(tags, AcquisitionConstant.TAG_MODULE_TYPE, reading.getModuleType());
        tags.put(AcquisitionConstant.TAG_BLOCK_ID, String.valueOf(reading.getBlockId()));
        return new BatchPoint(measurement, tags, fields, reading.getTimestamp());
    }

    @JSONField(serialize = false)
    public String getDeviceId() {
        return tags == null ? null : tags.get(AcquisitionConstant.TAG_DEVICE_ID);
    }

    private static void putIfPresent(Map<String, String> tags, String key, String value) {
        if (value != null && !value.isBlank()) {
            tags.put(key, value);
        }
    }
}
