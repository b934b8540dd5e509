package com.wangbin.acquisition.core.overflow;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 溢出缓存：时序库写入失败的数据落盘，之后按入队顺序重放。
 * <p>
 * 每条记录要么仍在缓存中，要么已写入时序库，要么按容量/保留策略被淘汰并计数。
 * 同一时刻只运行一个重放过程。
 */
@Slf4j
public class OverflowCache {

    private final OverflowRepository repository;
    private final AcquisitionProperties.Overflow config;
    private final LongSupplier clock;
    private final ReentrantLock replayLock = new ReentrantLock();
    private final Object writeMonitor = new Object();

    private final AtomicLong enqueued = new AtomicLong(0);
    private final AtomicLong replayed = new AtomicLong(0);
    private final AtomicLong evicted = new AtomicLong(0);
    private final AtomicLong failedPasses = new AtomicLong(0);
    private volatile long lastReplayTime;

    public OverflowCache(OverflowRepository repository, AcquisitionProperties.Overflow config, LongSupplier clock) {
        this.repository = repository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 持久化一批写入点
     *
     * @return 实际入队的数量
     */
    public int enqueue(List<BatchPoint> points) {
        if (points == null || points.isEmpty()) {
            return 0;
        }
        long now = clock.getAsLong();
        List<OverflowRecord> records = new ArrayList<>(points.size());
        for (BatchPoint point : points) {
            records.add(OverflowRecord.of(point, now));
        }
        synchronized (writeMonitor) {
            try {
                if (config.getEvictionPolicy() == OverflowEvictionPolicy.DROP_NEWEST) {
                    long free = Math.max(0, config.getMaxRecords() - repository.count());
                    if (free < records.size()) {
                        recordEviction(records.size() - free, "缓存已满，丢弃新数据");
                        records = records.subList(0, (int) free);
                    }
                }
                repository.appendAll(records);
                enqueued.addAndGet(records.size());
                long depth = repository.count();
                if (config.getEvictionPolicy() == OverflowEvictionPolicy.DROP_OLDEST && depth > config.getMaxRecords()) {
                    int removed = repository.evictOldest(depth - config.getMaxRecords());
                    recordEviction(removed, "缓存已满，淘汰最早数据");
                    depth -= removed;
                }
                log.warn("[溢出缓存] 写入 {} 条，当前深度 {}", records.size(), depth);
                return records.size();
            } catch (DataAccessException e) {
                recordEviction(records.size(), "缓存落盘失败");
                log.error("[溢出缓存] 落盘失败: {}", e.getMessage(), e);
                return 0;
            }
        }
    }

    /**
     * 按入队顺序重放。时序库不可达时立即停止，等待下一次触发；
     * 被时序库拒绝的记录逐条重试，超过 max-attempts 次后丢弃并计入淘汰数。
     *
     * @return 本次成功重放的数量
     */
    public int replay(TimeSeriesStore store) {
        if (!replayLock.tryLock()) {
            log.debug("[溢出缓存] 已有重放在进行，跳过");
            return 0;
        }
        int replayedThisPass = 0;
        try {
            int maxPerPass = Math.max(1, config.getMaxRecordsPerPass());
            int batchSize = Math.max(1, config.getReplayBatchSize());
            while (replayedThisPass < maxPerPass) {
                int limit = Math.min(batchSize, maxPerPass - replayedThisPass);
                List<OverflowRecord> chunk = repository.findOldest(limit);
                if (chunk.isEmpty()) {
                    break;
                }
                List<Pending> valid = dropCorrupted(chunk);
                if (valid.isEmpty()) {
                    continue;
                }
                ChunkResult result = replayChunk(store, valid);
                replayedThisPass += result.delivered;
                replayed.addAndGet(result.delivered);
                if (result.stopPass) {
                    failedPasses.incrementAndGet();
                    break;
                }
                if (chunk.size() < limit) {
                    break;
                }
            }
            lastReplayTime = clock.getAsLong();
            if (replayedThisPass > 0) {
                log.info("[溢出缓存] 重放成功 {} 条，剩余 {}", replayedThisPass, repository.count());
            }
            return replayedThisPass;
        } catch (DataAccessException e) {
            failedPasses.incrementAndGet();
            log.error("[溢出缓存] 重放读取缓存失败: {}", e.getMessage(), e);
            return replayedThisPass;
        } finally {
            replayLock.unlock();
        }
    }

    private List<Pending> dropCorrupted(List<OverflowRecord> chunk) {
        List<Pending> valid = new ArrayList<>(chunk.size());
        List<Long> corrupted = new ArrayList<>();
        for (OverflowRecord record : chunk) {
            BatchPoint point = record.toPoint();
            if (point == null) {
                corrupted.add(record.getId());
            } else {
                valid.add(new Pending(record, point));
            }
        }
        if (!corrupted.isEmpty()) {
            int removed = repository.deleteByIds(corrupted);
            recordEviction(removed, "记录内容损坏");
        }
        return valid;
    }

    private ChunkResult replayChunk(TimeSeriesStore store, List<Pending> records) {
        try {
            store.writeBatch(pointsOf(records));
            repository.deleteByIds(idsOf(records));
            return new ChunkResult(records.size(), false);
        } catch (AcquisitionException e) {
            if (!e.isRejected()) {
                log.warn("[溢出缓存] 时序库不可用，保留 {} 条等待下次重放: {}", records.size(), e.getMessage());
                return new ChunkResult(0, true);
            }
            log.warn("[溢出缓存] 批次被时序库拒绝，逐条重试 {} 条: {}", records.size(), e.getMessage());
            return replayOneByOne(store, records);
        } catch (RuntimeException e) {
            log.error("[溢出缓存] 重放写入异常，保留 {} 条等待下次重放", records.size(), e);
            return new ChunkResult(0, true);
        }
    }

    // 拒绝次数未达上限的记录仍留在队首，本轮结束，下一轮再试
    private ChunkResult replayOneByOne(TimeSeriesStore store, List<Pending> records) {
        int delivered = 0;
        boolean keptRejected = false;
        for (Pending pending : records) {
            OverflowRecord record = pending.record;
            try {
                store.writeBatch(List.of(pending.point));
                repository.deleteByIds(List.of(record.getId()));
                delivered++;
            } catch (AcquisitionException e) {
                if (!e.isRejected()) {
                    return new ChunkResult(delivered, true);
                }
                if (!rejectRecord(record, e.getMessage())) {
                    keptRejected = true;
                }
            } catch (RuntimeException e) {
                log.error("[溢出缓存] 重放写入异常，记录 {} 保留", record.getId(), e);
                return new ChunkResult(delivered, true);
            }
        }
        return new ChunkResult(delivered, keptRejected);
    }

    /**
     * @return 记录是否已被丢弃
     */
    private boolean rejectRecord(OverflowRecord record, String reason) {
        int attempts = record.getAttempts() + 1;
        if (attempts >= config.getMaxAttempts()) {
            int removed = repository.deleteByIds(List.of(record.getId()));
            recordEviction(removed, "设备 " + record.getDeviceId() + " 的记录被拒绝 " + attempts + " 次: " + reason);
            return true;
        }
        repository.incrementAttempts(List.of(record.getId()));
        log.warn("[溢出缓存] 记录 {} 被拒绝 ({}/{}): {}", record.getId(), attempts, config.getMaxAttempts(), reason);
        return false;
    }

    private static List<BatchPoint> pointsOf(List<Pending> records) {
        List<BatchPoint> points = new ArrayList<>(records.size());
        for (Pending pending : records) {
            points.add(pending.point);
        }
        return points;
    }

    private static List<Long> idsOf(List<Pending> records) {
        List<Long> ids = new ArrayList<>(records.size());
        for (Pending pending : records) {
            ids.add(pending.record.getId());
        }
        return ids;
    }

    private static final class Pending {
        private final OverflowRecord record;
        private final BatchPoint point;

        private Pending(OverflowRecord record, BatchPoint point) {
            this.record = record;
            this.point = point;
        }
    }

    private static final class ChunkResult {
        private final int delivered;
        private final boolean stopPass;

        private ChunkResult(int delivered, boolean stopPass) {
            this.delivered = delivered;
            this.stopPass = stopPass;
        }
    }

    /**
     * 清理超过保留期的记录
     */
    public int purgeExpired() {
        if (config.getRetentionDays() <= 0) {
            return 0;
        }
        long cutoff = clock.getAsLong() - TimeUnit.DAYS.toMillis(config.getRetentionDays());
        synchronized (writeMonitor) {
            int removed = repository.deleteOlderThan(cutoff);
            recordEviction(removed, "超过保留期 " + config.getRetentionDays() + " 天");
            return removed;
        }
    }

    public long depth() {
        return repository.count();
    }

    public OverflowStats getStats() {
        return OverflowStats.builder()
                .depth(repository.count())
                .maxRecords(config.getMaxRecords())
                .evictionPolicy(config.getEvictionPolicy())
                .enqueued(enqueued.get())
                .replayed(replayed.get())
                .evicted(evicted.get())
                .failedPasses(failedPasses.get())
                .lastReplayTime(lastReplayTime)
                .build();
    }

    private void recordEviction(long count, String reason) {
        if (count <= 0) {
            return;
        }
        evicted.addAndGet(count);
        log.error("[溢出缓存] 数据丢弃 {} 条 ({})，累计丢弃 {}", count, reason, evicted.get());
    }
}
