package com.wangbin.acquisition.core.lifecycle;

import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.broadcast.BroadcastHub;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.poll.PollScheduler;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 采集生命周期：持有全部周期任务句柄，按固定顺序启动与停止。
 * <p>
 * 停止顺序：推送与心跳检查 -> 采集 -> 最终写入 -> 重放与清理 -> 断开设备链路。
 */
@Slf4j
public class AcquisitionLifecycle {

    private final AcquisitionProperties properties;
    private final AcquisitionExecutors executors;
    private final DeviceLink deviceLink;
    private final PollScheduler pollScheduler;
    private final BatchWriter batchWriter;
    private final OverflowCache overflowCache;
    private final TimeSeriesStore store;
    private final BroadcastHub broadcastHub;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledFuture<?> pollHandle;
    private ScheduledFuture<?> ageHandle;
    private ScheduledFuture<?> replayHandle;
    private ScheduledFuture<?> purgeHandle;
    private ScheduledFuture<?> pushHandle;
    private ScheduledFuture<?> reaperHandle;

    public AcquisitionLifecycle(AcquisitionProperties properties, AcquisitionExecutors executors,
                                DeviceLink deviceLink, PollScheduler pollScheduler, BatchWriter batchWriter,
                                OverflowCache overflowCache, TimeSeriesStore store, BroadcastHub broadcastHub) {
        this.properties = properties;
        this.executors = executors;
        this.deviceLink = deviceLink;
        this.pollScheduler = pollScheduler;
        this.batchWriter = batchWriter;
        this.overflowCache = overflowCache;
        this.store = store;
        this.broadcastHub = broadcastHub;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isEnabled()) {
            log.info("[生命周期] 采集已禁用 (acquisition.enabled=false)");
            return;
        }
        start();
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            log.warn("[生命周期] 已经启动");
            return;
        }
        log.info("[生命周期] 启动采集服务，数据源 {}，模式 {}", deviceLink.getEndpoint(), properties.getPlc().getMode());

        // 设备链路只在采集线程上使用
        executors.getPoll().execute(guard("初始连接", deviceLink::connect));
        pollScheduler.start();
        pollHandle = executors.getPoll().scheduleAtFixedRate(guard("采集", pollScheduler::tick),
                0, properties.getPoll().getIntervalMs(), TimeUnit.MILLISECONDS);

        long ageInterval = properties.getBatch().getAgeCheckIntervalMs();
        ageHandle = executors.getFlush().scheduleWithFixedDelay(guard("缓冲时长检查", batchWriter::checkAge),
                ageInterval, ageInterval, TimeUnit.MILLISECONDS);

        long replayInterval = properties.getOverflow().getReplayIntervalMs();
        replayHandle = executors.getReplay().scheduleWithFixedDelay(guard("溢出重放", () -> overflowCache.replay(store)),
                replayInterval, replayInterval, TimeUnit.MILLISECONDS);
        purgeHandle = executors.getPurge().scheduleWithFixedDelay(guard("过期清理", overflowCache::purgeExpired),
                0, properties.getOverflow().getPurgeIntervalMs(), TimeUnit.MILLISECONDS);

        pushHandle = executors.getPush().scheduleAtFixedRate(guard("实时推送", broadcastHub::pushRealtime),
                properties.getBroadcast().getPushIntervalMs(), properties.getBroadcast().getPushIntervalMs(),
                TimeUnit.MILLISECONDS);
        long reaperInterval = properties.getBroadcast().getReaperIntervalMs();
        reaperHandle = executors.getReaper().scheduleWithFixedDelay(guard("心跳检查", broadcastHub::reapExpired),
                reaperInterval, reaperInterval, TimeUnit.MILLISECONDS);
        log.info("[生命周期] 周期任务已启动: 采集 {}ms，推送 {}ms，重放 {}ms",
                properties.getPoll().getIntervalMs(), properties.getBroadcast().getPushIntervalMs(), replayInterval);
    }

    @PreDestroy
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        long timeout = properties.getShutdownTimeoutMs();
        log.info("[生命周期] 开始停止采集服务");

        cancel(pushHandle);
        cancel(reaperHandle);
        AcquisitionExecutors.shutdownAndAwait(executors.getPush(), "实时推送", timeout);
        AcquisitionExecutors.shutdownAndAwait(executors.getReaper(), "心跳检查", timeout);
        broadcastHub.closeAll();

        pollScheduler.stop();
        cancel(pollHandle);
        AcquisitionExecutors.shutdownAndAwait(executors.getPoll(), "采集", timeout);

        cancel(ageHandle);
        AcquisitionExecutors.shutdownAndAwait(executors.getFlush(), "批量写入", timeout);
        int flushed = batchWriter.flush();
        log.info("[生命周期] 最终写入 {} 点", flushed);

        cancel(replayHandle);
        cancel(purgeHandle);
        AcquisitionExecutors.shutdownAndAwait(executors.getReplay(), "溢出重放", timeout);
        AcquisitionExecutors.shutdownAndAwait(executors.getPurge(), "过期清理", timeout);

        deviceLink.disconnect();
        log.info("[生命周期] 采集服务已停止，溢出缓存剩余 {} 条", overflowCache.depth());
    }

    public boolean isStarted() {
        return started.get();
    }

    private void cancel(ScheduledFuture<?> handle) {
        if (handle != null) {
            handle.cancel(false);
        }
    }

    // 周期任务抛出异常会终止后续调度，这里统一兜底
    private Runnable guard(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[生命周期] 周期任务 {} 异常", name, e);
            }
        };
    }
}
