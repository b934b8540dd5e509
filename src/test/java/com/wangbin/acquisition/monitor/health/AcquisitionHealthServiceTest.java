package com.wangbin.acquisition.monitor.health;

import com.wangbin.acquisition.common.domain.enums.ConnectionStatus;
import com.wangbin.acquisition.core.batch.BatchWriter;
import com.wangbin.acquisition.core.batch.BatchWriterStats;
import com.wangbin.acquisition.core.broadcast.BroadcastHub;
import com.wangbin.acquisition.core.broadcast.BroadcastStats;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import com.wangbin.acquisition.core.lifecycle.AcquisitionLifecycle;
import com.wangbin.acquisition.core.link.DeviceLink;
import com.wangbin.acquisition.core.link.DeviceLinkStatus;
import com.wangbin.acquisition.core.overflow.OverflowCache;
import com.wangbin.acquisition.core.overflow.OverflowStats;
import com.wangbin.acquisition.core.poll.PollScheduler;
import com.wangbin.acquisition.core.poll.PollState;
import com.wangbin.acquisition.core.poll.PollStats;
import com.wangbin.acquisition.core.snapshot.SnapshotStore;
import com.wangbin.acquisition.core.store.TimeSeriesStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AcquisitionHealthServiceTest {

    private AcquisitionLifecycle lifecycle;
    private DeviceLink deviceLink;
    private PollScheduler pollScheduler;
    private BatchWriter batchWriter;
    private OverflowCache overflowCache;
    private TimeSeriesStore store;
    private AcquisitionHealthService service;

    @BeforeEach
    void setUp() {
        lifecycle = mock(AcquisitionLifecycle.class);
        deviceLink = mock(DeviceLink.class);
        pollScheduler = mock(PollScheduler.class);
        batchWriter = mock(BatchWriter.class);
        overflowCache = mock(OverflowCache.class);
        store = mock(TimeSeriesStore.class);
        BroadcastHub broadcastHub = mock(BroadcastHub.class);
        when(lifecycle.isStarted()).thenReturn(true);
        when(batchWriter.getStats()).thenReturn(BatchWriterStats.builder().build());
        when(broadcastHub.getStats()).thenReturn(BroadcastStats.builder().build());
        service = new AcquisitionHealthService(new AcquisitionProperties(), lifecycle, deviceLink, pollScheduler,
                new SnapshotStore(), batchWriter, overflowCache, store, broadcastHub);
    }

    private void givenLink(ConnectionStatus status, boolean healthy) {
        when(deviceLink.getStatus()).thenReturn(DeviceLinkStatus.builder()
                .endpoint("fake://plc").status(status).healthy(healthy).build());
    }

    private void givenLastOutcome(PollState outcome) {
        when(pollScheduler.getStats()).thenReturn(PollStats.builder().lastOutcome(outcome).build());
    }

    private void givenOverflowDepth(long depth) {
        when(overflowCache.getStats()).thenReturn(OverflowStats.builder().depth(depth).build());
    }

    @Test
    void allComponentsHealthyIsUp() {
        givenLink(ConnectionStatus.CONNECTED, true);
        givenLastOutcome(PollState.SUCCESS);
        givenOverflowDepth(0);
        when(store.isHealthy()).thenReturn(true);

        PipelineHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.UP, health.getStatus());
        assertEquals("plc", health.getSource());
        assertTrue(health.getDegradedComponents().isEmpty());
        assertEquals(5, health.getComponents().size());
    }

    @Test
    void storeOutageWithBacklogIsDegraded() {
        givenLink(ConnectionStatus.CONNECTED, true);
        givenLastOutcome(PollState.SUCCESS);
        givenOverflowDepth(120);
        when(store.isHealthy()).thenThrow(new IllegalStateException("refused"));

        PipelineHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.DEGRADED, health.getStatus());
        assertEquals(HealthLevel.DEGRADED, health.getComponents().get("store").getLevel());
        assertEquals(HealthLevel.DEGRADED, health.getComponents().get("overflow").getLevel());
        assertEquals(List.of("store", "overflow"), health.getDegradedComponents());
    }

    @Test
    void disconnectedPlcIsDown() {
        givenLink(ConnectionStatus.DISCONNECTED, false);
        givenLastOutcome(PollState.TOTAL_FAILURE);
        givenOverflowDepth(0);
        when(store.isHealthy()).thenReturn(true);

        assertEquals(HealthLevel.DOWN, service.getSystemHealth().getStatus());
    }

    @Test
    void partialPollFailureOnlyDegrades() {
        givenLink(ConnectionStatus.CONNECTED, true);
        givenLastOutcome(PollState.PARTIAL_FAILURE);
        givenOverflowDepth(0);
        when(store.isHealthy()).thenReturn(true);

        PipelineHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.DEGRADED, health.getStatus());
        assertEquals(List.of("polling"), health.getDegradedComponents());
    }

    @Test
    void pipelineBeforeStartIsNotStarted() {
        when(lifecycle.isStarted()).thenReturn(false);
        givenLink(ConnectionStatus.DISCONNECTED, false);
        givenLastOutcome(null);
        givenOverflowDepth(0);
        when(store.isHealthy()).thenReturn(true);

        PipelineHealth health = service.getSystemHealth();

        assertEquals(HealthLevel.NOT_STARTED, health.getStatus());
        assertFalse(health.isLifecycleStarted());
        assertEquals(HealthLevel.NOT_STARTED, health.getComponents().get("plc").getLevel());
        assertEquals(HealthLevel.NOT_STARTED, health.getComponents().get("polling").getLevel());
    }

    @Test
    void reconnectIsDelegatedToLink() {
        service.requestReconnect();

        verify(deviceLink).requestReconnect();
    }
}
