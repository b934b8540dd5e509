package com.wangbin.acquisition.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_NOT_FOUND(1001, "数据不存在"),

    // 采集相关错误
    CONNECTION_ERROR(2001, "连接错误"),
    DEVICE_ERROR(2003, "设备错误"),
    DATA_PROCESS_ERROR(2005, "数据处理错误"),
    STORE_ERROR(2007, "时序库写入错误"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    CONFIG_INVALID(3002, "配置无效"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用"),
    TIMEOUT_ERROR(5005, "超时错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
