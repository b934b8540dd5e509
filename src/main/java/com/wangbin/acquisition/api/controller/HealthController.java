package com.wangbin.acquisition.api.controller;

import com.wangbin.acquisition.common.web.result.ApiResult;
import com.wangbin.acquisition.core.link.DeviceLinkStatus;
import com.wangbin.acquisition.monitor.health.AcquisitionHealthService;
import com.wangbin.acquisition.monitor.health.PipelineHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 健康检查接口。
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

    private final AcquisitionHealthService healthService;

    @GetMapping
    public PipelineHealth health() {
        return healthService.getSystemHealth();
    }

    @GetMapping("/plc")
    public ApiResult<DeviceLinkStatus> plc() {
        return ApiResult.success(healthService.getPlcStatus());
    }

    @GetMapping("/polling")
    public ApiResult<Map<String, Object>> polling() {
        return ApiResult.success(healthService.getPollingStatus());
    }

    @PostMapping("/plc/reconnect")
    public ApiResult<Void> reconnect() {
        healthService.requestReconnect();
        return ApiResult.success("重连请求已提交，将在下一采集周期执行", null);
    }
}
