package com.wangbin.acquisition.core.poll;

import com.wangbin.acquisition.common.enums.DataType;
import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.convert.LinearValueConverter;
import com.wangbin.acquisition.core.decode.DeviceLayout;
import com.wangbin.acquisition.core.decode.FieldLayout;
import com.wangbin.acquisition.core.decode.OffsetMapDecoder;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.link.RetryPolicy;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import com.wangbin.acquisition.support.FakePlcTransport;
import com.wangbin.acquisition.support.MutableClock;
import com.wangbin.acquisition.support.RecordingTimeSeriesStore;
import com.wangbin.acquisition.support.TestOverflow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PollSchedulerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FakePlcTransport transport;
    private DeviceLink link;
    private SnapshotStore snapshotStore;
    private BatchWriter batchWriter;
    private PollScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_700_000_000_000L);
        transport = new FakePlcTransport()
                .withBlock(1, ByteBuffer.allocate(4).putFloat(1250.0f).array())
                .withBlock(2, ByteBuffer.allocate(4).putFloat(812.5f).array());
        link = new DeviceLink(transport,
                new RetryPolicy("read", 1, 0, millis -> { }),
                new RetryPolicy("reconnect", 1, 0, millis -> { }),
                1000, 1000, 10, clock);
        snapshotStore = new SnapshotStore();
        OverflowCache overflowCache = new OverflowCache(TestOverflow.repository(tempDir.resolve("overflow.db")),
                new AcquisitionProperties.Overflow(), clock);
        AcquisitionProperties.Batch batchConfig = new AcquisitionProperties.Batch();
        batchConfig.setCycleThreshold(100);
        batchWriter = new BatchWriter(new RecordingTimeSeriesStore(), overflowCache, batchConfig,
                Runnable::run, clock);
        List<DeviceLayout> devices = List.of(
                new DeviceLayout("hopper_1", "料仓1", "hopper", "hopper_sensor", 1, 0, 4,
                        List.of(new FieldLayout("weight", 0, DataType.FLOAT32, 0))),
                new DeviceLayout("kiln_1", "辊道窑1", "roller_kiln", "kiln_zone", 2, 0, 4,
                        List.of(new FieldLayout("temp", 0, DataType.FLOAT32, 0))));
        scheduler = new PollScheduler(link, devices, new OffsetMapDecoder(), new LinearValueConverter(null),
                snapshotStore, batchWriter, new AcquisitionProperties.Poll(), clock);
    }

    @Test
    void successfulCycleUpdatesSnapshotAndBuffer() {
        PollCycleResult result = scheduler.runCycle();

        assertEquals(PollState.SUCCESS, result.getOutcome());
        assertEquals(2, result.getReadings().size());
        assertEquals(2, snapshotStore.size());
        assertEquals(812.5, (Double) snapshotStore.get("kiln_1").orElseThrow().getValues().get("temp"), 1e-6);
        assertEquals(clock.getAsLong(), snapshotStore.get("hopper_1").orElseThrow().getTimestamp());
        assertEquals(2, batchWriter.getBufferSize());
        assertEquals(PollState.IDLE, scheduler.getState());
    }

    @Test
    void failingDeviceIsSkippedOthersStillDelivered() {
        transport.breakBlock(1);

        PollCycleResult result = scheduler.runCycle();

        assertEquals(PollState.PARTIAL_FAILURE, result.getOutcome());
        assertEquals(List.of("hopper_1"), result.getFailedDevices());
        assertTrue(snapshotStore.get("hopper_1").isEmpty());
        assertTrue(snapshotStore.get("kiln_1").isPresent());
        assertEquals(1, batchWriter.getBufferSize());
    }

    @Test
    void totalFailureDoesNotThrowAndKeepsOldSnapshot() {
        scheduler.runCycle();
        long firstTimestamp = snapshotStore.get("kiln_1").orElseThrow().getTimestamp();
        transport.breakBlock(1);
        transport.breakBlock(2);
        clock.advance(5000);

        PollCycleResult result = assertDoesNotThrow(() -> scheduler.runCycle());

        assertEquals(PollState.TOTAL_FAILURE, result.getOutcome());
        assertEquals(firstTimestamp, snapshotStore.get("kiln_1").orElseThrow().getTimestamp());
        PollStats stats = scheduler.getStats();
        assertEquals(2, stats.getTotalCycles());
        assertEquals(1, stats.getSuccessCycles());
        assertEquals(1, stats.getTotalFailureCycles());
        assertEquals(List.of("hopper_1", "kiln_1"), stats.getLastFailedDevices());
    }

    @Test
    void decodeErrorSkipsOnlyThatDevice() {
        DeviceLayout broken = new DeviceLayout("bad", null, "hopper", "hopper_sensor", 3, 0, 2,
                List.of(new FieldLayout("weight", 0, DataType.FLOAT32, 0)));
        DeviceLayout kiln = scheduler.getDevices().get(1);
        PollScheduler mixed = new PollScheduler(link, List.of(broken, kiln), new OffsetMapDecoder(),
                new LinearValueConverter(null), snapshotStore, batchWriter, new AcquisitionProperties.Poll(), clock);

        PollCycleResult result = mixed.runCycle();

        assertEquals(PollState.PARTIAL_FAILURE, result.getOutcome());
        assertEquals(List.of("bad"), result.getFailedDevices());
        assertEquals(0, link.getStatus().getConsecutiveErrors());
    }

    @Test
    void reconnectRequestIsHandledAtCycleStart() {
        assertTrue(link.connect());
        link.requestReconnect();

        scheduler.runCycle();

        assertEquals(2, transport.getConnectCount());
        assertTrue(transport.getCalls().contains("disconnect"));
        assertFalse(link.getStatus().isReconnectRequested());
    }

    @Test
    void tickRunsOnlyWhileStarted() {
        scheduler.tick();
        assertEquals(0, scheduler.getStats().getTotalCycles());

        scheduler.start();
        scheduler.tick();
        scheduler.stop();
        scheduler.tick();

        assertEquals(1, scheduler.getStats().getTotalCycles());
        assertFalse(scheduler.isRunning());
    }
}
