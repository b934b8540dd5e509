package com.wangbin.acquisition.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.acquisition.core.lifecycle.AcquisitionExecutors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    private ScheduledExecutorService singleThreadScheduler(String prefix) {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, buildNamedThreadFactory(prefix, true));
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * 采集、写入、重放、清理、推送、心跳检查各占一个线程，互不阻塞
     */
    @Bean
    public AcquisitionExecutors acquisitionExecutors() {
        return new AcquisitionExecutors(
                singleThreadScheduler("acq-poll"),
                singleThreadScheduler("acq-flush"),
                singleThreadScheduler("acq-replay"),
                singleThreadScheduler("acq-purge"),
                singleThreadScheduler("ws-push"),
                singleThreadScheduler("ws-reaper"));
    }
}
