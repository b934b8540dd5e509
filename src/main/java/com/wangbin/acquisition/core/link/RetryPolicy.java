package com.wangbin.acquisition.core.link;

import lombok.Getter;

/**
 * 有界重试策略：最大尝试次数 + 两次尝试之间的固定等待。
 * 读取重试与重连退避各持有一个独立实例。
 */
@Getter
public final class RetryPolicy {

    private final String name;
    private final int maxAttempts;
    private final long delayMillis;
    private final Sleeper sleeper;

    public RetryPolicy(String name, int maxAttempts, long delayMillis, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException(name + " 最大尝试次数必须大于0");
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException(name + " 重试间隔不能为负数");
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.delayMillis = delayMillis;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    public static RetryPolicy of(String name, int maxAttempts, long delayMillis) {
        return new RetryPolicy(name, maxAttempts, delayMillis, Sleeper.SYSTEM);
    }

    /**
     * 执行操作，失败时按策略等待后重试；全部失败则抛出最后一次的异常。
     * 中断不重试，直接抛出。
     */
    public <T> T execute(Attempt<T> attempt, FailureListener listener) throws Exception {
        Exception last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            if (i > 1 && delayMillis > 0) {
                sleeper.sleep(delayMillis);
            }
            try {
                return attempt.run(i);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                last = e;
                if (listener != null) {
                    listener.onFailure(i, e);
                }
            }
        }
        throw last;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws Exception;
    }

    @FunctionalInterface
    public interface FailureListener {
        void onFailure(int attempt, Exception cause);
    }

    @Override
    public String toString() {
        return name + "{maxAttempts=" + maxAttempts + ", delayMillis=" + delayMillis + "}";
    }
}
