package com.wangbin.acquisition.core.decode;

import com.wangbin.acquisition.common.exception.AcquisitionException;

import java.util.Map;

/**
 * 原始字节到命名字段的解析边界
 */
public interface ReadingDecoder {

    /**
     * 按布局解析数据块
     *
     * @throws AcquisitionException 数据块长度不足或字段越界时抛出 DECODE 异常
     */
    Map<String, Object> decode(byte[] raw, DeviceLayout layout) throws AcquisitionException;
}
