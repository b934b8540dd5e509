package com.wangbin.acquisition.core.batch;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.domain.entity.Reading;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.store.InfluxDbTimeSeriesStore;
import com.wangbin.acquisition.support.MutableClock;
import com.wangbin.acquisition.support.RecordingTimeSeriesStore;
import com.wangbin.acquisition.support.TestOverflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class BatchWriterTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private RecordingTimeSeriesStore store;
    private OverflowCache overflowCache;
    private AcquisitionProperties.Batch config;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        store = new RecordingTimeSeriesStore();
        overflowCache = new OverflowCache(TestOverflow.repository(tempDir.resolve("overflow.db")),
                new AcquisitionProperties.Overflow(), clock);
        config = new AcquisitionProperties.Batch();
        config.setCycleThreshold(10);
        config.setMaxPoints(1000);
        config.setMaxAgeMs(60_000);
    }

    private BatchWriter newWriter() {
        return new BatchWriter(store, overflowCache, config, Runnable::run, clock);
    }

    private List<Reading> cycle(int devices, long timestamp) {
        List<Reading> readings = new ArrayList<>();
        for (int i = 0; i < devices; i++) {
            readings.add(Reading.builder()
                    .deviceId("dev-" + i)
                    .deviceType("hopper")
                    .moduleType("hopper_sensor")
                    .blockId(1)
                    .timestamp(timestamp)
                    .values(Map.of("weight", 100.0 + i))
                    .build());
        }
        return readings;
    }

    @Test
    void writesOneBatchAfterCycleThreshold() {
        BatchWriter writer = newWriter();

        for (int i = 0; i < 10; i++) {
            assertEquals(0, store.getAttempts());
            writer.append(cycle(3, clock.advance(5000)));
            writer.completeCycle();
        }

        assertEquals(1, store.getBatches().size());
        assertEquals(30, store.getBatches().get(0).size());
        assertEquals(0, writer.getBufferSize());
        assertEquals(0, overflowCache.depth());
        assertEquals(clock.getAsLong(), writer.getLastFlushTime());
    }

    @Test
    void emptyCyclesDoNotWrite() {
        BatchWriter writer = newWriter();

        for (int i = 0; i < 25; i++) {
            writer.completeCycle();
        }

        assertEquals(0, store.getAttempts());
    }

    @Test
    void maxPointsTriggersEarlyWrite() {
        config.setMaxPoints(5);
        BatchWriter writer = newWriter();

        writer.append(cycle(3, 1));
        assertEquals(0, store.getAttempts());
        writer.append(cycle(3, 2));

        assertEquals(1, store.getBatches().size());
        assertEquals(6, store.getBatches().get(0).size());
    }

    @Test
    void maxAgeTriggersWrite() {
        config.setMaxAgeMs(1000);
        BatchWriter writer = newWriter();
        writer.append(cycle(2, 1));

        clock.advance(999);
        writer.checkAge();
        assertEquals(0, store.getAttempts());

        clock.advance(1);
        writer.checkAge();
        assertEquals(1, store.getBatches().size());
    }

    @Test
    void failedWritesGoToOverflowAndDrainInOrder() {
        config.setCycleThreshold(1);
        BatchWriter writer = newWriter();
        store.failNext(3);

        for (int i = 1; i <= 4; i++) {
            writer.append(List.of(Reading.builder()
                    .deviceId("d" + i).timestamp(i).values(Map.of("v", i)).build()));
            writer.completeCycle();
        }

        List<String> received = store.getReceivedPoints().stream().map(BatchPoint::getDeviceId).toList();
        assertEquals(List.of("d4", "d1", "d2", "d3"), received);
        assertEquals(0, overflowCache.depth());
        BatchWriterStats stats = writer.getStats();
        assertEquals(3, stats.getFailedFlushes());
        assertEquals(3, stats.getPointsDiverted());
        assertEquals(1, stats.getPointsWritten());
        assertEquals(3, overflowCache.getStats().getReplayed());
    }

    @Test
    void everyPointIsWrittenOrCachedWhileStoreIsDown() {
        config.setCycleThreshold(2);
        BatchWriter writer = newWriter();
        store.setDown(true);

        for (int i = 0; i < 6; i++) {
            writer.append(cycle(4, i));
            writer.completeCycle();
        }

        assertEquals(0, store.getReceivedPoints().size());
        assertEquals(24, overflowCache.depth());
        assertEquals(0, writer.getBufferSize());

        store.setDown(false);
        writer.append(cycle(4, 100));
        writer.completeCycle();
        writer.completeCycle();

        assertEquals(28, store.getReceivedPoints().size());
        assertEquals(0, overflowCache.depth());
    }

    @Test
    void rejectedFlushKeepsBufferForFinalFlush() {
        config.setCycleThreshold(1);
        BatchWriter writer = new BatchWriter(store, overflowCache, config, task -> {
            throw new RejectedExecutionException("shutdown");
        }, clock);

        writer.append(cycle(2, 1));
        writer.completeCycle();
        assertEquals(2, writer.getBufferSize());

        assertEquals(2, writer.flush());
        assertEquals(1, store.getBatches().size());
        assertEquals(0, writer.flush());
    }

    @Test
    void uncheckedStoreFailureDivertsBatchToOverflow() {
        config.setCycleThreshold(1);
        store.throwUnexpected(new IllegalStateException("client closed"));
        BatchWriter writer = newWriter();

        writer.append(cycle(3, 1));
        writer.completeCycle();

        assertEquals(0, writer.getBufferSize());
        assertEquals(3, overflowCache.depth());
        BatchWriterStats stats = writer.getStats();
        assertEquals(1, stats.getFailedFlushes());
        assertEquals(3, stats.getPointsDiverted());
        assertEquals(0, stats.getPointsWritten());
    }

    @Test
    void invalidTokenHeaderDoesNotLoseBatch() {
        AcquisitionProperties.Store storeConfig = new AcquisitionProperties.Store();
        storeConfig.setUrl("http://127.0.0.1:9");
        storeConfig.setToken("abc\n");
        BatchWriter writer = new BatchWriter(new InfluxDbTimeSeriesStore(storeConfig), overflowCache, config,
                Runnable::run, clock);

        writer.append(cycle(2, 1));

        assertEquals(2, writer.flush());
        assertEquals(0, writer.getBufferSize());
        assertEquals(2, overflowCache.depth());
        assertEquals(1, writer.getStats().getFailedFlushes());
    }
}
