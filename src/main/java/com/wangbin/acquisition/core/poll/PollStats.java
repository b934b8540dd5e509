package com.wangbin.acquisition.core.poll;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class PollStats {

    private boolean running;
    private PollState state;
    private long intervalMs;
    private int deviceCount;
    private long totalCycles;
    private long successCycles;
    private long partialFailureCycles;
    private long totalFailureCycles;
    private long lastCycleTime;
    private long lastCycleDurationMs;
    private PollState lastOutcome;
    private List<String> lastFailedDevices;
}
