package com.wangbin.acquisition.common.constant;

/**
 * 采集服务常量
 */
public final class AcquisitionConstant {

    private AcquisitionConstant() {
    }

    // 实时推送频道
    public static final String CHANNEL_REALTIME = "realtime";

    // 时序库 measurement
    public static final String MEASUREMENT_SENSOR_DATA = "sensor_data";

    // 时序库 tag
    public static final String TAG_DEVICE_ID = "device_id";
    public static final String TAG_DEVICE_TYPE = "device_type";
    public static final String TAG_MODULE_TYPE = "module_type";
    public static final String TAG_BLOCK_ID = "block_id";

    // 数据来源
    public static final String SOURCE_PLC = "plc";
    public static final String SOURCE_MOCK = "mock";

    // WebSocket 消息类型
    public static final String MESSAGE_TYPE_SUBSCRIBE = "subscribe";
    public static final String MESSAGE_TYPE_UNSUBSCRIBE = "unsubscribe";
    public static final String MESSAGE_TYPE_HEARTBEAT = "heartbeat";
    public static final String MESSAGE_TYPE_REALTIME_DATA = "realtime_data";
    public static final String MESSAGE_TYPE_ERROR = "error";

    // WebSocket 错误码
    public static final String ERROR_INVALID_CHANNEL = "INVALID_CHANNEL";
    public static final String ERROR_INVALID_MESSAGE = "INVALID_MESSAGE";
}
