package com.wangbin.acquisition.core.link;

/**
 * 等待抽象，测试中可替换为不真正休眠的实现
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
