package com.wangbin.acquisition.support;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.store.TimeSeriesStore;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 记录收到的批次，可模拟连续写入失败、按设备拒绝数据以及非受检异常
 */
public class RecordingTimeSeriesStore implements TimeSeriesStore {

    private final List<List<BatchPoint>> batches = new ArrayList<>();
    private int failuresRemaining;
    private boolean down;
    private int attempts;
    private final Set<String> rejectedDevices = new HashSet<>();
    private RuntimeException unexpected;

    /**
     * 含该设备数据点的批次都会被当作坏数据拒绝
     */
    public synchronized void rejectDevice(String deviceId) {
        rejectedDevices.add(deviceId);
    }

    public synchronized void throwUnexpected(RuntimeException error) {
        this.unexpected = error;
    }

    public synchronized void failNext(int count) {
        this.failuresRemaining = count;
    }

    public synchronized void setDown(boolean down) {
        this.down = down;
    }

    @Override
    public synchronized void writeBatch(List<BatchPoint> points) throws AcquisitionException {
        attempts++;
        if (unexpected != null) {
            throw unexpected;
        }
        for (BatchPoint point : points) {
            if (rejectedDevices.contains(point.getDeviceId())) {
                throw AcquisitionException.storeRejectedException("bad point from " + point.getDeviceId());
            }
        }
        if (down || failuresRemaining > 0) {
            if (failuresRemaining > 0) {
                failuresRemaining--;
            }
            throw AcquisitionException.storeWriteException("store unavailable", null);
        }
        batches.add(new ArrayList<>(points));
    }

    @Override
    public synchronized boolean isHealthy() {
        return !down;
    }

    public synchronized List<List<BatchPoint>> getBatches() {
        return new ArrayList<>(batches);
    }

    public synchronized List<BatchPoint> getReceivedPoints() {
        List<BatchPoint> all = new ArrayList<>();
        batches.forEach(all::addAll);
        return all;
    }

    public synchronized int getAttempts() {
        return attempts;
    }
}
