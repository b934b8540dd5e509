package com.wangbin.acquisition.core.link;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedPlcTransportTest {

    @Test
    void producesFiniteFloatsInEverySlot() {
        SimulatedPlcTransport transport = new SimulatedPlcTransport(() -> 123_456L);
        transport.connect(1000);

        byte[] data = transport.read(2, 0, 24, 1000);

        assertEquals(24, data.length);
        ByteBuffer buffer = ByteBuffer.wrap(data);
        for (int i = 0; i < 24; i += 4) {
            float value = buffer.getFloat(i);
            assertTrue(Float.isFinite(value));
            assertTrue(value > 0);
        }
    }

    @Test
    void readRequiresConnection() {
        SimulatedPlcTransport transport = new SimulatedPlcTransport();

        assertFalse(transport.isAlive());
        assertThrows(IllegalStateException.class, () -> transport.read(1, 0, 4, 1000));
    }
}
