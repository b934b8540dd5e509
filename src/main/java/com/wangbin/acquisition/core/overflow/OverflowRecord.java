package com.wangbin.acquisition.core.overflow;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.utils.JsonUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 溢出缓存记录，id 即入队顺序
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverflowRecord {

    private Long id;
    private String deviceId;
    private String measurement;
    /** BatchPoint 的 JSON */
    private String payload;
    private long pointTime;
    private long enqueuedAt;
    private int attempts;

    public static OverflowRecord of(BatchPoint point, long enqueuedAt) {
        return OverflowRecord.builder()
                .deviceId(point.getDeviceId())
                .measurement(point.getMeasurement())
                .payload(JsonUtil.toJsonString(point))
                .pointTime(point.getTimestamp())
                .enqueuedAt(enqueuedAt)
                .attempts(0)
                .build();
    }

    /**
     * 还原写入点，payload 损坏时返回 null
     */
    public BatchPoint toPoint() {
        return payload == null ? null : JsonUtil.parseObject(payload, BatchPoint.class);
    }
}
