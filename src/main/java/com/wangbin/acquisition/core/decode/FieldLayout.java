package com.wangbin.acquisition.core.decode;

import com.wangbin.acquisition.common.enums.DataType;

/**
 * 字段在数据块中的位置，offset 相对设备起始偏移
 */
public record FieldLayout(String name, int offset, DataType dataType, int bit) {

    public int endOffset() {
        return offset + dataType.getByteLength();
    }
}
