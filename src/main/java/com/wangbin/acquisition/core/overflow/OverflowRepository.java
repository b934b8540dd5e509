package com.wangbin.acquisition.core.overflow;

import java.util.List;

/**
 * 溢出记录持久化，按入队顺序读取
 */
public interface OverflowRepository {

    /**
     * 单事务追加
     */
    void appendAll(List<OverflowRecord> records);

    long count();

    List<OverflowRecord> findOldest(int limit);

    int deleteByIds(List<Long> ids);

    void incrementAttempts(List<Long> ids);

    int evictOldest(long count);

    int deleteOlderThan(long enqueuedBefore);
}
