package com.wangbin.acquisition.core.lifecycle;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 各周期任务独立的单线程调度器
 */
@Slf4j
@Getter
public class AcquisitionExecutors implements AutoCloseable {

    private final ScheduledExecutorService poll;
    private final ScheduledExecutorService flush;
    private final ScheduledExecutorService replay;
    private final ScheduledExecutorService purge;
    private final ScheduledExecutorService push;
    private final ScheduledExecutorService reaper;

    public AcquisitionExecutors(ScheduledExecutorService poll, ScheduledExecutorService flush,
                                ScheduledExecutorService replay, ScheduledExecutorService purge,
                                ScheduledExecutorService push, ScheduledExecutorService reaper) {
        this.poll = poll;
        this.flush = flush;
        this.replay = replay;
        this.purge = purge;
        this.push = push;
        this.reaper = reaper;
    }

    /**
     * 停止接收任务并等待执行中的任务结束，超时后强制中断
     */
    public static void shutdownAndAwait(ExecutorService executor, String name, long timeoutMs) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("[生命周期] {} 等待超时，强制关闭", name);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[生命周期] {} 关闭被中断", name, e);
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        for (ExecutorService executor : List.of(poll, flush, replay, purge, push, reaper)) {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }
    }
}
