package com.wangbin.acquisition.common.domain.enums;

import lombok.Getter;

/**
 * 设备链路状态枚举
 */
@Getter
public enum ConnectionStatus {

    DISCONNECTED("DISCONNECTED", "已断开", 0),
    CONNECTED("CONNECTED", "已连接", 1),
    RECONNECTING("RECONNECTING", "重连中", 2);

    private final String code;
    private final String description;
    private final int level;

    ConnectionStatus(String code, String description, int level) {
        this.code = code;
        this.description = description;
        this.level = level;
    }
}
