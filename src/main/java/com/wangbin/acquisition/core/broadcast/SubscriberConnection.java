package com.wangbin.acquisition.core.broadcast;

import java.io.IOException;

/**
 * 订阅者连接，与具体传输无关
 */
public interface SubscriberConnection {

    String getId();

    void send(String message) throws IOException;

    void close();

    boolean isOpen();
}
