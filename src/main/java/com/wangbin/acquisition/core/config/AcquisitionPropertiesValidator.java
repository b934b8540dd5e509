package com.wangbin.acquisition.core.config;

import com.wangbin.acquisition.common.constant.AcquisitionConstant;
import com.wangbin.acquisition.common.enums.DataType;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties.DeviceDefinition;
import com.wangbin.acquisition.core.config.AcquisitionProperties.FieldDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 启动配置的跨字段校验，任何错误都会终止启动
 * <p>
 * 单字段取值范围由 {@link AcquisitionProperties} 上的约束注解在绑定时校验
 */
public final class AcquisitionPropertiesValidator {

    /**
     * 当前支持推送的频道
     */
    private static final Set<String> KNOWN_CHANNELS = Set.of(AcquisitionConstant.CHANNEL_REALTIME);

    private AcquisitionPropertiesValidator() {
    }

    public static void validate(AcquisitionProperties properties) throws AcquisitionException {
        List<String> errors = new ArrayList<>();
        validatePlc(properties.getPlc(), errors);
        validateBroadcast(properties.getBroadcast(), errors);
        validateDevices(properties.getDevices(), errors);

        if (!errors.isEmpty()) {
            throw AcquisitionException.configException("采集配置无效: " + String.join("; ", errors));
        }
    }

    private static void validatePlc(AcquisitionProperties.Plc plc, List<String> errors) {
        if (!"mock".equalsIgnoreCase(plc.getMode()) && (plc.getHost() == null || plc.getHost().isBlank())) {
            errors.add("plc.host 在 modbus 模式下不能为空");
        }
    }

    private static void validateBroadcast(AcquisitionProperties.Broadcast broadcast, List<String> errors) {
        // 巡检间隔大于心跳超时会让过期连接滞留超过一个超时周期
        if (broadcast.getReaperIntervalMs() > broadcast.getHeartbeatTimeoutMs()) {
            errors.add("broadcast.reaper-interval-ms 不能大于 heartbeat-timeout-ms");
        }
        if (broadcast.getChannels() != null) {
            for (String channel : broadcast.getChannels()) {
                if (!KNOWN_CHANNELS.contains(channel)) {
                    errors.add("broadcast.channels 不支持的频道: " + channel);
                }
            }
        }
    }

    private static void validateDevices(List<DeviceDefinition> devices, List<String> errors) {
        if (devices == null) {
            errors.add("至少需要一个启用的设备");
            return;
        }
        Set<String> ids = new HashSet<>();
        int enabled = 0;
        for (DeviceDefinition device : devices) {
            if (!device.isEnabled()) {
                continue;
            }
            enabled++;
            String id = device.getDeviceId();
            if (id == null || id.isBlank()) {
                continue;
            }
            if (!ids.add(id)) {
                errors.add("设备ID重复: " + id);
            }
            if (device.getFields() == null || device.getFields().isEmpty()) {
                errors.add(id + " 未配置字段");
                continue;
            }
            for (FieldDefinition field : device.getFields()) {
                validateField(id, device.getSize(), field, errors);
            }
        }
        if (enabled == 0) {
            errors.add("至少需要一个启用的设备");
        }
    }

    private static void validateField(String deviceId, int size, FieldDefinition field, List<String> errors) {
        if (field.getName() == null) {
            return;
        }
        DataType type;
        try {
            type = DataType.fromString(field.getType());
        } catch (IllegalArgumentException e) {
            errors.add(deviceId + "." + field.getName() + " 数据类型无效: " + field.getType());
            return;
        }
        if (size > 0 && field.getOffset() + type.getByteLength() > size) {
            errors.add(deviceId + "." + field.getName() + " 超出数据块长度 " + size);
        }
    }
}
