package com.wangbin.acquisition.support;

import com.wangbin.acquisition.core.broadcast.SubscriberConnection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class FakeSubscriberConnection implements SubscriberConnection {

    private final String id;
    private final List<String> sent = new ArrayList<>();
    private boolean open = true;
    private boolean failOnSend;
    private int closeCount;

    public FakeSubscriberConnection(String id) {
        this.id = id;
    }

    public void setFailOnSend(boolean failOnSend) {
        this.failOnSend = failOnSend;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public void send(String message) throws IOException {
        if (failOnSend) {
            throw new IOException("broken pipe");
        }
        sent.add(message);
    }

    @Override
    public void close() {
        open = false;
        closeCount++;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public List<String> getSent() {
        return sent;
    }

    public String lastSent() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1);
    }

    public int getCloseCount() {
        return closeCount;
    }
}
