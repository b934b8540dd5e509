package com.wangbin.acquisition.common.exception;

import com.wangbin.acquisition.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 采集链路异常
 */
@Getter
public class AcquisitionException extends BusinessException {

    /**
     * 错误分类
     */
    public enum Kind {
        /** 设备不可达 */
        CONNECTION(ResultCode.CONNECTION_ERROR),
        /** 设备可达但读取未完成 */
        READ_TIMEOUT(ResultCode.TIMEOUT_ERROR),
        /** 数据块格式错误 */
        DECODE(ResultCode.DATA_PROCESS_ERROR),
        /** 时序库不可达或拒绝写入 */
        STORE_WRITE(ResultCode.STORE_ERROR),
        /** 启动配置错误 */
        CONFIG(ResultCode.CONFIG_INVALID);

        private final ResultCode resultCode;

        Kind(ResultCode resultCode) {
            this.resultCode = resultCode;
        }

        public ResultCode getResultCode() {
            return resultCode;
        }
    }

    private final Kind kind;
    private final String deviceId;
    /** 时序库明确拒绝该批数据（数据本身有问题），重试不会成功 */
    private final boolean rejected;

    public AcquisitionException(Kind kind, String message, String deviceId) {
        this(kind, message, deviceId, null, false);
    }

    public AcquisitionException(Kind kind, String message, String deviceId, Throwable cause) {
        this(kind, message, deviceId, cause, false);
    }

    private AcquisitionException(Kind kind, String message, String deviceId, Throwable cause, boolean rejected) {
        super(kind.getResultCode().getCode(), message, cause);
        this.kind = kind;
        this.deviceId = deviceId;
        this.rejected = rejected;
    }

    // 创建连接异常
    public static AcquisitionException connectionException(String message, Throwable cause) {
        return new AcquisitionException(Kind.CONNECTION, message, null, cause);
    }

    // 创建读取超时异常
    public static AcquisitionException readTimeoutException(String message, Throwable cause) {
        return new AcquisitionException(Kind.READ_TIMEOUT, message, null, cause);
    }

    // 创建解析异常
    public static AcquisitionException decodeException(String message, String deviceId) {
        return new AcquisitionException(Kind.DECODE, message, deviceId);
    }

    // 创建写入异常
    public static AcquisitionException storeWriteException(String message, Throwable cause) {
        return new AcquisitionException(Kind.STORE_WRITE, message, null, cause);
    }

    // 时序库拒绝写入（4xx 类数据错误）
    public static AcquisitionException storeRejectedException(String message) {
        return new AcquisitionException(Kind.STORE_WRITE, message, null, null, true);
    }

    // 创建配置异常
    public static AcquisitionException configException(String message) {
        return new AcquisitionException(Kind.CONFIG, message, null);
    }

    public boolean isRetryable() {
        if (rejected) {
            return false;
        }
        return kind == Kind.CONNECTION || kind == Kind.READ_TIMEOUT || kind == Kind.STORE_WRITE;
    }
}
