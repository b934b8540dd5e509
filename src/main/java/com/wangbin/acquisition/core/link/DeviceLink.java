package com.wangbin.acquisition.core.link;

import com.wangbin.acquisition.common.domain.enums.ConnectionStatus;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * 设备链路：唯一持有 PLC 连接，负责存活检测、有界重试读取与重连。
 * <p>
 * 连续错误达到阈值后，下一次读取前强制重连。
 * 所有读取与重连都在采集线程上执行；运维发起的重连只置标记，由采集线程消费。
 */
@Slf4j
public class DeviceLink {

    private final PlcTransport transport;
    private final RetryPolicy readPolicy;
    private final RetryPolicy reconnectPolicy;
    private final long connectTimeoutMs;
    private final long readTimeoutMs;
    private final int errorThreshold;
    private final LongSupplier clock;

    private volatile ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private volatile boolean healthy;
    private volatile String lastError;
    private volatile long lastConnectTime;
    private volatile long lastReadTime;

    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final AtomicLong totalConnects = new AtomicLong(0);
    private final AtomicLong totalReads = new AtomicLong(0);
    private final AtomicLong failedReads = new AtomicLong(0);
    private final AtomicBoolean reconnectRequested = new AtomicBoolean(false);

    public DeviceLink(PlcTransport transport, RetryPolicy readPolicy, RetryPolicy reconnectPolicy,
                      long connectTimeoutMs, long readTimeoutMs, int errorThreshold) {
        this(transport, readPolicy, reconnectPolicy, connectTimeoutMs, readTimeoutMs, errorThreshold,
                System::currentTimeMillis);
    }

    public DeviceLink(PlcTransport transport, RetryPolicy readPolicy, RetryPolicy reconnectPolicy,
                      long connectTimeoutMs, long readTimeoutMs, int errorThreshold, LongSupplier clock) {
        this.transport = transport;
        this.readPolicy = readPolicy;
        this.reconnectPolicy = reconnectPolicy;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
        this.errorThreshold = Math.max(1, errorThreshold);
        this.clock = clock;
    }

    /**
     * 确保连接可用，已有连接先做存活检测再复用
     */
    public boolean connect() {
        if (status == ConnectionStatus.CONNECTED && healthy) {
            if (transport.isAlive()) {
                return true;
            }
            log.warn("[PLC] 存活检测失败，重新建立连接: {}", transport.getEndpoint());
            healthy = false;
        }
        try {
            transport.connect(connectTimeoutMs);
            onConnected("连接建立");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onConnectFailed(e);
            return false;
        } catch (Exception e) {
            onConnectFailed(e);
            return false;
        }
    }

    /**
     * 读取数据块，失败按读取策略重试。
     *
     * @throws AcquisitionException 重试耗尽后抛出，超时类失败标记为 READ_TIMEOUT
     */
    public byte[] readBlock(int blockId, int offset, int size) throws AcquisitionException {
        if (consecutiveErrors.get() >= errorThreshold) {
            log.warn("[PLC] 连续错误 {} 次达到阈值 {}，读取前强制重连", consecutiveErrors.get(), errorThreshold);
            if (!reconnect()) {
                failedReads.incrementAndGet();
                throw AcquisitionException.connectionException(
                        "PLC 重连失败，跳过块 " + blockId + " 读取: " + transport.getEndpoint(), null);
            }
        }
        totalReads.incrementAndGet();
        try {
            byte[] data = readPolicy.execute(
                    attempt -> readOnce(blockId, offset, size),
                    (attempt, cause) -> onReadFailure(blockId, attempt, cause));
            consecutiveErrors.set(0);
            lastReadTime = clock.getAsLong();
            return data;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failedReads.incrementAndGet();
            throw AcquisitionException.connectionException("PLC 读取被中断: 块 " + blockId, e);
        } catch (Exception e) {
            failedReads.incrementAndGet();
            throw classify(blockId, e);
        }
    }

    /**
     * 断开后按重连策略重新建立连接
     */
    public boolean reconnect() {
        log.info("[PLC] 开始重连: {}", transport.getEndpoint());
        transition(ConnectionStatus.RECONNECTING, "重连开始");
        healthy = false;
        transport.disconnect();
        try {
            reconnectPolicy.execute(attempt -> {
                transport.connect(connectTimeoutMs);
                return Boolean.TRUE;
            }, (attempt, cause) -> {
                lastError = describe(cause);
                log.warn("[PLC] 重连失败 (尝试 {}/{}): {}", attempt, reconnectPolicy.getMaxAttempts(), lastError);
            });
            consecutiveErrors.set(0);
            onConnected("重连成功");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            onConnectFailed(e);
            return false;
        } catch (Exception e) {
            onConnectFailed(e);
            log.error("[PLC] 重连放弃，已尝试 {} 次: {}", reconnectPolicy.getMaxAttempts(), transport.getEndpoint());
            return false;
        }
    }

    public void disconnect() {
        healthy = false;
        transport.disconnect();
        transition(ConnectionStatus.DISCONNECTED, "主动断开");
    }

    /**
     * 运维发起的重连请求，由采集线程在下一周期开始时处理
     */
    public void requestReconnect() {
        reconnectRequested.set(true);
        log.info("[PLC] 收到重连请求: {}", transport.getEndpoint());
    }

    public boolean consumeReconnectRequest() {
        return reconnectRequested.getAndSet(false);
    }

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String getEndpoint() {
        return transport.getEndpoint();
    }

    public DeviceLinkStatus getStatus() {
        return DeviceLinkStatus.builder()
                .endpoint(transport.getEndpoint())
                .status(status)
                .healthy(healthy)
                .consecutiveErrors(consecutiveErrors.get())
                .errorThreshold(errorThreshold)
                .totalConnects(totalConnects.get())
                .totalReads(totalReads.get())
                .failedReads(failedReads.get())
                .lastError(lastError)
                .lastConnectTime(lastConnectTime)
                .lastReadTime(lastReadTime)
                .reconnectRequested(reconnectRequested.get())
                .build();
    }

    private byte[] readOnce(int blockId, int offset, int size) throws Exception {
        if (!(status == ConnectionStatus.CONNECTED && healthy) && !connect()) {
            throw AcquisitionException.connectionException("PLC 未连接: " + transport.getEndpoint(), null);
        }
        byte[] data = transport.read(blockId, offset, size, readTimeoutMs);
        if (data == null || data.length < size) {
            throw new IllegalStateException("读取字节数不足: 期望 " + size + "，实际 "
                    + (data == null ? 0 : data.length));
        }
        return data;
    }

    private void onReadFailure(int blockId, int attempt, Exception cause) {
        healthy = false;
        int errors = consecutiveErrors.incrementAndGet();
        lastError = describe(cause);
        log.warn("[PLC] 块 {} 读取失败 (尝试 {}/{}，连续错误 {}): {}",
                blockId, attempt, readPolicy.getMaxAttempts(), errors, lastError);
    }

    private void onConnected(String reason) {
        healthy = true;
        totalConnects.incrementAndGet();
        lastConnectTime = clock.getAsLong();
        lastError = null;
        transition(ConnectionStatus.CONNECTED, reason);
    }

    private void onConnectFailed(Exception e) {
        healthy = false;
        lastError = describe(e);
        transition(ConnectionStatus.DISCONNECTED, "连接失败");
        log.warn("[PLC] 连接失败: {} - {}", transport.getEndpoint(), lastError);
    }

    private void transition(ConnectionStatus next, String reason) {
        ConnectionStatus previous = status;
        status = next;
        if (previous != next) {
            log.info("[PLC] 状态变更 {} -> {} ({}): {}", previous, next, reason, transport.getEndpoint());
        }
    }

    private AcquisitionException classify(int blockId, Exception e) {
        if (e instanceof AcquisitionException acquisitionException) {
            return acquisitionException;
        }
        String message = "PLC 块 " + blockId + " 读取失败，已重试 " + readPolicy.getMaxAttempts() + " 次: " + describe(e);
        if (isTimeout(e)) {
            return AcquisitionException.readTimeoutException(message, e);
        }
        return AcquisitionException.connectionException(message, e);
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
