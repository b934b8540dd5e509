package com.wangbin.acquisition.common.enums;

import lombok.Getter;

/**
 * 寄存器数据类型（大端序）
 */
@Getter
public enum DataType {
    INT16(2), UINT16(2),
    INT32(4), UINT32(4),
    FLOAT32(4),
    BOOL(1);

    /**
     * 数据类型占用的字节长度
     */
    private final int byteLength;

    DataType(int byteLength) {
        this.byteLength = byteLength;
    }

    /**
     * 根据字符串获取枚举，REAL/WORD/DWORD 按 PLC 习惯映射
     */
    public static DataType fromString(String type) {
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("数据类型不能为空");
        }
        String normalized = type.trim().toUpperCase();
        return switch (normalized) {
            case "REAL", "FLOAT" -> FLOAT32;
            case "INT" -> INT16;
            case "WORD" -> UINT16;
            case "DINT" -> INT32;
            case "DWORD" -> UINT32;
            case "BOOLEAN" -> BOOL;
            default -> DataType.valueOf(normalized);
        };
    }
}
