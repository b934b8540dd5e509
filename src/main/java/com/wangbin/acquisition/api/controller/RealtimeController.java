package com.wangbin.acquisition.api.controller;

import com.wangbin.acquisition.common.domain.entity.Reading;
import com.wangbin.acquisition.common.exception.BusinessException;
import com.wangbin.acquisition.common.web.result.ApiResult;
import com.wangbin.acquisition.common.web.result.ResultCode;
import com.wangbin.acquisition.core.broadcast.BroadcastHub;
import com.wangbin.acquisition.core.broadcast.BroadcastStats;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 最新快照查询与推送状态
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RealtimeController {

    private final SnapshotStore snapshotStore;
    private final BroadcastHub broadcastHub;

    @GetMapping("/realtime")
    public ApiResult<?> realtime(@RequestParam(required = false) String deviceType) {
        if (deviceType != null && !deviceType.isBlank()) {
            return ApiResult.success(snapshotStore.getByDeviceType(deviceType));
        }
        Map<String, Reading> all = snapshotStore.getAll();
        List<Reading> readings = new ArrayList<>(all.values());
        return ApiResult.success(readings);
    }

    @GetMapping("/realtime/{deviceId}")
    public ApiResult<Reading> device(@PathVariable String deviceId) {
        Reading reading = snapshotStore.get(deviceId)
                .orElseThrow(() -> new BusinessException(ResultCode.DATA_NOT_FOUND.getCode(), "设备暂无数据: " + deviceId));
        return ApiResult.success(reading);
    }

    @GetMapping("/ws/status")
    public ApiResult<BroadcastStats> wsStatus() {
        return ApiResult.success(broadcastHub.getStats());
    }
}
