package com.wangbin.acquisition.core.snapshot;

import com.wangbin.acquisition.common.domain.entity.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 设备最新读数快照。
 * <p>
 * 每个设备只保留最新一条读数，时间戳更旧的更新被丢弃；
 * 读操作返回副本，不会看到写入一半的状态。
 */
@Slf4j
@Component
public class SnapshotStore {

    private final Map<String, Reading> latest = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile long latestTimestamp;

    /**
     * 更新设备读数
     *
     * @return 是否已生效，时间戳早于当前值时返回 false
     */
    public boolean update(Reading reading) {
        if (reading == null || reading.getDeviceId() == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            Reading current = latest.get(reading.getDeviceId());
            if (current != null && reading.getTimestamp() < current.getTimestamp()) {
                log.debug("丢弃过期读数: {} {} < {}", reading.getDeviceId(),
                        reading.getTimestamp(), current.getTimestamp());
                return false;
            }
            // 先移除再放入，保持按更新先后排序
            latest.remove(reading.getDeviceId());
            latest.put(reading.getDeviceId(), reading);
            if (reading.getTimestamp() > latestTimestamp) {
                latestTimestamp = reading.getTimestamp();
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean update(String deviceId, Reading reading) {
        if (reading != null && !reading.getDeviceId().equals(deviceId)) {
            throw new IllegalArgumentException("设备ID与读数不一致: " + deviceId + " != " + reading.getDeviceId());
        }
        return update(reading);
    }

    public Map<String, Reading> getAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(latest));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Reading> get(String deviceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(latest.get(deviceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Reading> getByDeviceType(String deviceType) {
        lock.readLock().lock();
        try {
            List<Reading> result = new ArrayList<>();
            for (Reading reading : latest.values()) {
                if (deviceType != null && deviceType.equals(reading.getDeviceType())) {
                    result.add(reading);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return latest.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 所有设备中最新的采集时间，尚无数据时为 0
     */
    public long getLatestTimestamp() {
        return latestTimestamp;
    }
}
