package com.wangbin.acquisition.monitor.health;

/**
 * 组件及采集链路的健康等级
 */
public enum HealthLevel {
    /** 正常 */
    UP,
    /** 可继续采集，但有数据滞留或部分失败 */
    DEGRADED,
    /** 无法采集 */
    DOWN,
    /** 生命周期尚未启动 */
    NOT_STARTED
}
