package com.wangbin.acquisition.core.store;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.exception.AcquisitionException;

import java.util.List;

/**
 * 时序库写入边界。
 * 同一 measurement + 标签 + 时间戳重复写入时覆盖，重放不会产生重复数据。
 */
public interface TimeSeriesStore {

    /**
     * 整批写入
     *
     * @throws AcquisitionException STORE_WRITE，时序库不可达或拒绝写入
     */
    void writeBatch(List<BatchPoint> points) throws AcquisitionException;

    boolean isHealthy();
}
