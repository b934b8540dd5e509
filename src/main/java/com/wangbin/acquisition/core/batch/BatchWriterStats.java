package com.wangbin.acquisition.core.batch;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class BatchWriterStats {

    private long flushCount;
    private long failedFlushes;
    private long pointsWritten;
    private long pointsDiverted;
    private long lastFlushTime;
    private int bufferSize;
    private int bufferedCycles;
}
