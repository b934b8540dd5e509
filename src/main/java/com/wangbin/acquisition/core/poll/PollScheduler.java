package com.wangbin.acquisition.core.poll;

import com.wangbin.acquisition.common.domain.entity.Reading;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.convert.ValueConverter;
import com.wangbin.acquisition.core.decode.DeviceLayout;
import com.wangbin.acquisition.core.decode.ReadingDecoder;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 轮询调度：每个周期依次读取所有设备，单个设备失败只跳过该设备。
 * <p>
 * 成功的读数先写入快照，再交给批量写入器。周期内的任何数据错误都不会向外抛出。
 */
@Slf4j
public class PollScheduler {

    private final DeviceLink deviceLink;
    private final List<DeviceLayout> devices;
    private final ReadingDecoder decoder;
    private final ValueConverter converter;
    private final SnapshotStore snapshotStore;
    private final BatchWriter batchWriter;
    private final AcquisitionProperties.Poll config;
    private final LongSupplier clock;

    private volatile PollState state = PollState.IDLE;
    private volatile boolean running;
    private volatile PollCycleResult lastResult;

    private final AtomicLong totalCycles = new AtomicLong(0);
    private final AtomicLong successCycles = new AtomicLong(0);
    private final AtomicLong partialFailureCycles = new AtomicLong(0);
    private final AtomicLong totalFailureCycles = new AtomicLong(0);

    public PollScheduler(DeviceLink deviceLink, List<DeviceLayout> devices, ReadingDecoder decoder,
                         ValueConverter converter, SnapshotStore snapshotStore, BatchWriter batchWriter,
                         AcquisitionProperties.Poll config, LongSupplier clock) {
        this.deviceLink = deviceLink;
        this.devices = List.copyOf(devices);
        this.decoder = decoder;
        this.converter = converter;
        this.snapshotStore = snapshotStore;
        this.batchWriter = batchWriter;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 执行一个采集周期
     */
    public PollCycleResult runCycle() {
        long cycle = totalCycles.incrementAndGet();
        long startTime = clock.getAsLong();
        state = PollState.READING;

        if (deviceLink.consumeReconnectRequest()) {
            log.info("[采集] 处理重连请求");
            deviceLink.reconnect();
        }

        List<Reading> readings = new ArrayList<>(devices.size());
        List<String> failedDevices = new ArrayList<>();
        for (DeviceLayout device : devices) {
            Reading reading = readDevice(device);
            if (reading != null) {
                readings.add(reading);
            } else {
                failedDevices.add(device.getDeviceId());
            }
        }

        for (Reading reading : readings) {
            snapshotStore.update(reading);
        }
        try {
            batchWriter.append(readings);
            batchWriter.completeCycle();
        } catch (RuntimeException e) {
            log.error("[采集] 第 {} 轮交付批量写入异常", cycle, e);
        }

        PollState outcome = resolveOutcome(readings.size());
        long duration = clock.getAsLong() - startTime;
        PollCycleResult result = new PollCycleResult(cycle, outcome, readings, failedDevices, startTime, duration);
        record(result);
        state = PollState.IDLE;
        return result;
    }

    /**
     * 定时任务入口
     */
    public void tick() {
        if (!running) {
            return;
        }
        runCycle();
    }

    public void start() {
        running = true;
        log.info("[采集] 轮询启动，间隔 {}ms，设备 {} 个", config.getIntervalMs(), devices.size());
    }

    public void stop() {
        running = false;
        log.info("[采集] 轮询停止，共完成 {} 轮", totalCycles.get());
    }

    public boolean isRunning() {
        return running;
    }

    public PollState getState() {
        return state;
    }

    public PollCycleResult getLastResult() {
        return lastResult;
    }

    public List<DeviceLayout> getDevices() {
        return devices;
    }

    public PollStats getStats() {
        PollCycleResult last = lastResult;
        return PollStats.builder()
                .running(running)
                .state(state)
                .intervalMs(config.getIntervalMs())
                .deviceCount(devices.size())
                .totalCycles(totalCycles.get())
                .successCycles(successCycles.get())
                .partialFailureCycles(partialFailureCycles.get())
                .totalFailureCycles(totalFailureCycles.get())
                .lastCycleTime(last != null ? last.getStartTime() : 0)
                .lastCycleDurationMs(last != null ? last.getDurationMs() : 0)
                .lastOutcome(last != null ? last.getOutcome() : null)
                .lastFailedDevices(last != null ? last.getFailedDevices() : Collections.emptyList())
                .build();
    }

    private Reading readDevice(DeviceLayout device) {
        try {
            byte[] raw = deviceLink.readBlock(device.getBlockId(), device.getOffset(), device.getSize());
            Map<String, Object> rawValues = decoder.decode(raw, device);
            Map<String, Object> values = converter.convert(device.getModuleType(), rawValues);
            return Reading.builder()
                    .deviceId(device.getDeviceId())
                    .deviceName(device.getDeviceName())
                    .deviceType(device.getDeviceType())
                    .moduleType(device.getModuleType())
                    .blockId(device.getBlockId())
                    .timestamp(clock.getAsLong())
                    .values(values)
                    .build();
        } catch (AcquisitionException e) {
            log.warn("[采集] 设备 {} 本轮跳过 ({}): {}", device.getDeviceId(), e.getKind(), e.getMessage());
            return null;
        } catch (Exception e) {
            log.error("[采集] 设备 {} 处理异常，本轮跳过", device.getDeviceId(), e);
            return null;
        }
    }

    private PollState resolveOutcome(int succeeded) {
        if (succeeded == devices.size()) {
            return PollState.SUCCESS;
        }
        return succeeded == 0 ? PollState.TOTAL_FAILURE : PollState.PARTIAL_FAILURE;
    }

    private void record(PollCycleResult result) {
        lastResult = result;
        switch (result.getOutcome()) {
            case SUCCESS -> successCycles.incrementAndGet();
            case PARTIAL_FAILURE -> partialFailureCycles.incrementAndGet();
            default -> totalFailureCycles.incrementAndGet();
        }
        if (config.isVerbose()) {
            log.info("[采集] 第 {} 轮 {}，成功 {} 个，失败 {}，耗时 {}ms", result.getCycle(), result.getOutcome(),
                    result.getReadings().size(), result.getFailedDevices(), result.getDurationMs());
        } else {
            log.debug("[采集] 第 {} 轮 {}，耗时 {}ms", result.getCycle(), result.getOutcome(), result.getDurationMs());
        }
        if (config.getSummaryEveryCycles() > 0 && result.getCycle() % config.getSummaryEveryCycles() == 0) {
            log.info("[采集] 已完成 {} 轮：成功 {}，部分失败 {}，全部失败 {}，设备状态 {}",
                    result.getCycle(), successCycles.get(), partialFailureCycles.get(), totalFailureCycles.get(),
                    deviceLink.getStatus().getStatus());
        }
    }
}
