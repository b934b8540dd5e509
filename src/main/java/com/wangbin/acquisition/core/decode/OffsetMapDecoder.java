package com.wangbin.acquisition.core.decode;

import com.wangbin.acquisition.common.exception.AcquisitionException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 按偏移表解析大端序数据块
 */
public class OffsetMapDecoder implements ReadingDecoder {

    @Override
    public Map<String, Object> decode(byte[] raw, DeviceLayout layout) throws AcquisitionException {
        if (raw == null) {
            throw AcquisitionException.decodeException("数据块为空", layout.getDeviceId());
        }
        ByteBuffer buffer = ByteBuffer.wrap(raw).order(ByteOrder.BIG_ENDIAN);
        Map<String, Object> values = new LinkedHashMap<>();
        for (FieldLayout field : layout.getFields()) {
            if (field.offset() < 0 || field.endOffset() > raw.length) {
                throw AcquisitionException.decodeException(String.format(
                        "字段 %s 越界: 偏移 %d 长度 %d，数据块长度 %d",
                        field.name(), field.offset(), field.dataType().getByteLength(), raw.length),
                        layout.getDeviceId());
            }
            values.put(field.name(), readValue(buffer, field));
        }
        return values;
    }

    private Object readValue(ByteBuffer buffer, FieldLayout field) {
        int offset = field.offset();
        return switch (field.dataType()) {
            case INT16 -> (int) buffer.getShort(offset);
            case UINT16 -> buffer.getShort(offset) & 0xFFFF;
            case INT32 -> buffer.getInt(offset);
            case UINT32 -> buffer.getInt(offset) & 0xFFFFFFFFL;
            case FLOAT32 -> (double) buffer.getFloat(offset);
            case BOOL -> ((buffer.get(offset) >> (field.bit() & 0x07)) & 0x01) == 1;
        };
    }
}
