package com.wangbin.acquisition.core.decode;

import com.wangbin.acquisition.common.enums.DataType;
import com.wangbin.acquisition.core.config.AcquisitionProperties.DeviceDefinition;
import com.wangbin.acquisition.core.config.AcquisitionProperties.FieldDefinition;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 设备数据块布局：块编号、起始偏移、长度与字段表
 */
@Getter
public class DeviceLayout {

    private final String deviceId;
    private final String deviceName;
    private final String deviceType;
    private final String moduleType;
    private final int blockId;
    private final int offset;
    private final int size;
    private final List<FieldLayout> fields;

    public DeviceLayout(String deviceId, String deviceName, String deviceType, String moduleType,
                        int blockId, int offset, int size, List<FieldLayout> fields) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.deviceType = deviceType;
        this.moduleType = moduleType;
        this.blockId = blockId;
        this.offset = offset;
        this.size = size;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    /**
     * 由配置构建布局；未指定 size 时取字段的最大结束偏移
     */
    public static DeviceLayout from(DeviceDefinition definition) {
        List<FieldLayout> fields = new ArrayList<>();
        int maxEnd = 0;
        for (FieldDefinition field : definition.getFields()) {
            FieldLayout layout = new FieldLayout(field.getName(), field.getOffset(),
                    DataType.fromString(field.getType()), field.getBit());
            fields.add(layout);
            maxEnd = Math.max(maxEnd, layout.endOffset());
        }
        int size = definition.getSize() > 0 ? definition.getSize() : maxEnd;
        return new DeviceLayout(definition.getDeviceId(), definition.getDeviceName(), definition.getDeviceType(),
                definition.getModuleType(), definition.getBlockId(), definition.getOffset(), size, fields);
    }
}
