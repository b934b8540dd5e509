package com.wangbin.acquisition.core.link;

/**
 * 现场控制器传输层，协议细节由具体实现委托给协议库
 */
public interface PlcTransport {

    /**
     * 建立连接，超时后抛出异常
     */
    void connect(long timeoutMillis) throws Exception;

    /**
     * 读取数据块
     *
     * @param blockId 数据块编号
     * @param offset  起始字节偏移
     * @param size    字节数
     */
    byte[] read(int blockId, int offset, int size, long timeoutMillis) throws Exception;

    /**
     * 连接是否存活
     */
    boolean isAlive();

    /**
     * 断开连接，不抛出异常
     */
    void disconnect();

    /**
     * 端点描述，用于日志与状态展示
     */
    String getEndpoint();
}
