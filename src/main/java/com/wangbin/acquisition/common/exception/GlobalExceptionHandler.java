package com.wangbin.acquisition.common.exception;

import com.wangbin.acquisition.common.web.result.ApiResult;
import com.wangbin.acquisition.common.web.result.ResultCode;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理采集链路异常
     */
    @ExceptionHandler(AcquisitionException.class)
    public ApiResult<?> handleAcquisitionException(AcquisitionException e, HttpServletRequest request) {
        log.error("采集异常 - Kind: {}, Device: {}, Uri: {}", e.getKind(), e.getDeviceId(), request.getRequestURI(), e);
        ApiResult<Object> result = ApiResult.error(e.getCode(), e.getMessage());
        result.addExtra("kind", e.getKind().name());
        if (e.getDeviceId() != null) {
            result.addExtra("deviceId", e.getDeviceId());
        }
        return result;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ApiResult<?> handleBusinessException(BusinessException e, HttpServletRequest request) {
        log.error("业务异常: {} - {}", e.getCode(), e.getMessage(), e);
        return ApiResult.error(e.getCode(), e.getMessage());
    }

    /**
     * 处理参数异常
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ApiResult<?> handleIllegalArgumentException(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("参数异常: {}", e.getMessage());
        return ApiResult.error(ResultCode.PARAM_ERROR.getCode(), e.getMessage());
    }

    /**
     * 处理其他异常
     */
    @ExceptionHandler(Exception.class)
    public ApiResult<?> handleException(Exception e, HttpServletRequest request) {
        log.error("系统异常: {}", request.getRequestURI(), e);
        return ApiResult.error(ResultCode.SYSTEM_ERROR);
    }
}
