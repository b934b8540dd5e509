package com.wangbin.acquisition.core.poll;

/**
 * 采集周期状态：IDLE -> READING -> 结果态 -> IDLE
 */
public enum PollState {
    IDLE,
    READING,
    SUCCESS,
    PARTIAL_FAILURE,
    TOTAL_FAILURE
}
