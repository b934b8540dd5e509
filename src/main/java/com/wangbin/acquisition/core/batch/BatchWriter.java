package com.wangbin.acquisition.core.batch;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.domain.entity.Reading;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 批量写入器：跨周期缓冲写入点，达到周期阈值、点数上限或最大缓冲时长时整批写入时序库。
 * <p>
 * 写入在独立的刷新线程上执行，采集线程不会因写入阻塞；
 * 写入失败的整批数据转入溢出缓存，内存缓冲无论成败都会清空。
 */
@Slf4j
public class BatchWriter {

    private final TimeSeriesStore store;
    private final OverflowCache overflowCache;
    private final AcquisitionProperties.Batch config;
    private final Executor flushExecutor;
    private final LongSupplier clock;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final Object flushMonitor = new Object();
    private List<BatchPoint> buffer = new ArrayList<>();
    private int bufferedCycles;
    private long firstPointAt;
    private boolean flushPending;

    private final AtomicLong flushCount = new AtomicLong(0);
    private final AtomicLong failedFlushes = new AtomicLong(0);
    private final AtomicLong pointsWritten = new AtomicLong(0);
    private final AtomicLong pointsDiverted = new AtomicLong(0);
    private volatile long lastFlushTime;

    public BatchWriter(TimeSeriesStore store, OverflowCache overflowCache, AcquisitionProperties.Batch config,
                       Executor flushExecutor, LongSupplier clock) {
        this.store = store;
        this.overflowCache = overflowCache;
        this.config = config;
        this.flushExecutor = flushExecutor;
        this.clock = clock;
    }

    /**
     * 缓冲本周期的读数
     */
    public void append(List<Reading> readings) {
        if (readings == null || readings.isEmpty()) {
            return;
        }
        boolean trigger;
        bufferLock.lock();
        try {
            for (Reading reading : readings) {
                BatchPoint point = BatchPoint.fromReading(reading, config.getMeasurement());
                if (point != null) {
                    if (buffer.isEmpty()) {
                        firstPointAt = clock.getAsLong();
                    }
                    buffer.add(point);
                }
            }
            trigger = markPendingIf(buffer.size() >= config.getMaxPoints());
        } finally {
            bufferLock.unlock();
        }
        if (trigger) {
            requestFlush("缓冲点数达到上限 " + config.getMaxPoints());
        }
    }

    /**
     * 周期结束，累计周期数达到阈值时触发写入
     */
    public void completeCycle() {
        boolean trigger;
        bufferLock.lock();
        try {
            bufferedCycles++;
            trigger = markPendingIf(bufferedCycles >= config.getCycleThreshold() && !buffer.isEmpty());
        } finally {
            bufferLock.unlock();
        }
        if (trigger) {
            requestFlush("累计 " + config.getCycleThreshold() + " 个周期");
        }
    }

    /**
     * 最大缓冲时长检查，由定时任务调用
     */
    public void checkAge() {
        boolean trigger;
        bufferLock.lock();
        try {
            trigger = markPendingIf(!buffer.isEmpty() && clock.getAsLong() - firstPointAt >= config.getMaxAgeMs());
        } finally {
            bufferLock.unlock();
        }
        if (trigger) {
            requestFlush("超过最大缓冲时长 " + config.getMaxAgeMs() + "ms");
        }
    }

    /**
     * 取出缓冲并写入；失败时整批转入溢出缓存
     *
     * @return 本次取出的点数
     */
    public int flush() {
        synchronized (flushMonitor) {
            List<BatchPoint> batch;
            bufferLock.lock();
            try {
                batch = buffer;
                buffer = new ArrayList<>();
                bufferedCycles = 0;
                firstPointAt = 0;
                flushPending = false;
            } finally {
                bufferLock.unlock();
            }
            if (batch.isEmpty()) {
                return 0;
            }
            try {
                store.writeBatch(batch);
                flushCount.incrementAndGet();
                pointsWritten.addAndGet(batch.size());
                lastFlushTime = clock.getAsLong();
                log.info("[批量写入] 写入成功 {} 点", batch.size());
            } catch (AcquisitionException e) {
                log.warn("[批量写入] 写入失败，{} 点转入溢出缓存: {}", batch.size(), e.getMessage());
                divert(batch);
                return batch.size();
            } catch (RuntimeException e) {
                log.error("[批量写入] 写入异常，{} 点转入溢出缓存", batch.size(), e);
                divert(batch);
                return batch.size();
            }
            if (overflowCache.depth() > 0) {
                overflowCache.replay(store);
            }
            return batch.size();
        }
    }

    public int getBufferSize() {
        bufferLock.lock();
        try {
            return buffer.size();
        } finally {
            bufferLock.unlock();
        }
    }

    public long getLastFlushTime() {
        return lastFlushTime;
    }

    public BatchWriterStats getStats() {
        bufferLock.lock();
        try {
            return BatchWriterStats.builder()
                    .flushCount(flushCount.get())
                    .failedFlushes(failedFlushes.get())
                    .pointsWritten(pointsWritten.get())
                    .pointsDiverted(pointsDiverted.get())
                    .lastFlushTime(lastFlushTime)
                    .bufferSize(buffer.size())
                    .bufferedCycles(bufferedCycles)
                    .build();
        } finally {
            bufferLock.unlock();
        }
    }

    // 已取出的缓冲不能丢失，失败后整批落盘
    private void divert(List<BatchPoint> batch) {
        failedFlushes.incrementAndGet();
        pointsDiverted.addAndGet(batch.size());
        overflowCache.enqueue(batch);
    }

    // 调用方需持有 bufferLock
    private boolean markPendingIf(boolean condition) {
        if (condition && !flushPending) {
            flushPending = true;
            return true;
        }
        return false;
    }

    private void requestFlush(String reason) {
        log.debug("[批量写入] 触发写入: {}", reason);
        try {
            flushExecutor.execute(this::flush);
        } catch (RejectedExecutionException e) {
            bufferLock.lock();
            try {
                flushPending = false;
            } finally {
                bufferLock.unlock();
            }
            log.warn("[批量写入] 刷新线程已停止，缓冲保留至最终写入: {}", e.getMessage());
        }
    }
}
