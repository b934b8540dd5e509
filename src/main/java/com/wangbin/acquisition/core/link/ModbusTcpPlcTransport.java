package com.wangbin.acquisition.core.link;

import com.digitalpetri.modbus.client.ModbusTcpClient;
import com.digitalpetri.modbus.pdu.ReadHoldingRegistersRequest;
import com.digitalpetri.modbus.tcp.client.NettyTcpClientTransport;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Modbus TCP 传输实现：数据块编号映射为从站地址，字节区间映射为保持寄存器。
 */
@Slf4j
public class ModbusTcpPlcTransport implements PlcTransport {

    // 单次请求最多 125 个寄存器
    private static final int MAX_REGISTERS_PER_REQUEST = 125;

    private final String host;
    private final int port;
    private volatile ModbusTcpClient client;
    private volatile boolean linkUp;

    public ModbusTcpPlcTransport(String host, int port) {
        this.host = host;
        this.port = port;
    }

    @Override
    public void connect(long timeoutMillis) throws Exception {
        disconnect();
        NettyTcpClientTransport transport = NettyTcpClientTransport.create(cfg -> {
            cfg.hostname = host;
            cfg.port = port;
        });
        ModbusTcpClient newClient = ModbusTcpClient.create(transport);
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> {
            try {
                newClient.connect();
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        });
        try {
            future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            closeQuietly(newClient);
            throw new TimeoutException("Modbus TCP 连接超时(" + timeoutMillis + "ms): " + getEndpoint());
        } catch (ExecutionException e) {
            closeQuietly(newClient);
            throw unwrap(e);
        }
        client = newClient;
        linkUp = true;
        log.info("Modbus TCP 客户端创建完成: {}", getEndpoint());
    }

    @Override
    public byte[] read(int blockId, int offset, int size, long timeoutMillis) throws Exception {
        ModbusTcpClient current = client;
        if (current == null) {
            throw new IllegalStateException("Modbus TCP 客户端尚未连接: " + getEndpoint());
        }
        int startRegister = offset / 2;
        int endRegister = (offset + size + 1) / 2;
        byte[] registers = new byte[(endRegister - startRegister) * 2];
        int address = startRegister;
        while (address < endRegister) {
            int quantity = Math.min(MAX_REGISTERS_PER_REQUEST, endRegister - address);
            byte[] chunk;
            try {
                chunk = current.readHoldingRegistersAsync(blockId, new ReadHoldingRegistersRequest(address, quantity))
                        .toCompletableFuture()
                        .get(timeoutMillis, TimeUnit.MILLISECONDS)
                        .registers();
            } catch (ExecutionException e) {
                linkUp = false;
                throw unwrap(e);
            }
            System.arraycopy(chunk, 0, registers, (address - startRegister) * 2, Math.min(chunk.length, quantity * 2));
            address += quantity;
        }
        int skip = offset - startRegister * 2;
        byte[] result = new byte[size];
        System.arraycopy(registers, skip, result, 0, size);
        return result;
    }

    @Override
    public boolean isAlive() {
        ModbusTcpClient current = client;
        return current != null && linkUp;
    }

    @Override
    public void disconnect() {
        ModbusTcpClient current = client;
        client = null;
        linkUp = false;
        if (current != null) {
            closeQuietly(current);
        }
    }

    @Override
    public String getEndpoint() {
        return "modbus-tcp://" + host + ":" + port;
    }

    private void closeQuietly(ModbusTcpClient target) {
        try {
            target.disconnect();
        } catch (Exception e) {
            log.warn("关闭 Modbus TCP 客户端异常: {}", getEndpoint(), e);
        }
    }

    private Exception unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof Exception ex ? ex : e;
    }
}
