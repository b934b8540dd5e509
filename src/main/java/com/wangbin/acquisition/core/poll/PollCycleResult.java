package com.wangbin.acquisition.core.poll;

import com.wangbin.acquisition.common.domain.entity.Reading;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 单个采集周期的结果
 */
@Getter
@ToString
public class PollCycleResult {

    private final long cycle;
    private final PollState outcome;
    private final List<Reading> readings;
    private final List<String> failedDevices;
    private final long startTime;
    private final long durationMs;

    public PollCycleResult(long cycle, PollState outcome, List<Reading> readings, List<String> failedDevices,
                           long startTime, long durationMs) {
        this.cycle = cycle;
        this.outcome = outcome;
        this.readings = List.copyOf(readings);
        this.failedDevices = List.copyOf(failedDevices);
        this.startTime = startTime;
        this.durationMs = durationMs;
    }
}
