package com.wangbin.acquisition.core.link;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.function.LongSupplier;

/**
 * 模拟数据源：按 4 字节对齐写入缓慢变化的 REAL 值，用于无 PLC 的联调环境。
 */
@Slf4j
public class SimulatedPlcTransport implements PlcTransport {

    private final LongSupplier clock;
    private volatile boolean connected;

    public SimulatedPlcTransport() {
        this(System::currentTimeMillis);
    }

    public SimulatedPlcTransport(LongSupplier clock) {
        this.clock = clock;
    }

    @Override
    public void connect(long timeoutMillis) {
        connected = true;
        log.info("模拟数据源已就绪");
    }

    @Override
    public byte[] read(int blockId, int offset, int size, long timeoutMillis) {
        if (!connected) {
            throw new IllegalStateException("模拟数据源未连接");
        }
        ByteBuffer buffer = ByteBuffer.allocate(size).order(ByteOrder.BIG_ENDIAN);
        double phase = clock.getAsLong() / 60000.0;
        for (int position = 0; position + 4 <= size; position += 4) {
            int slot = (offset + position) / 4;
            double base = 50.0 + (blockId * 31 + slot * 7) % 400;
            double value = base + base * 0.05 * Math.sin(phase + slot);
            buffer.putFloat(position, (float) value);
        }
        return buffer.array();
    }

    @Override
    public boolean isAlive() {
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public String getEndpoint() {
        return "mock://simulated";
    }
}
