package com.wangbin.acquisition.core.overflow;

/**
 * 溢出缓存容量策略
 */
public enum OverflowEvictionPolicy {
    /** 淘汰最早入队的记录，保留最新数据 */
    DROP_OLDEST,
    /** 缓存已满时拒绝新记录 */
    DROP_NEWEST;

    public static OverflowEvictionPolicy from(String text) {
        if (text == null || text.isBlank()) {
            return DROP_OLDEST;
        }
        try {
            return OverflowEvictionPolicy.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return DROP_OLDEST;
        }
    }
}
