package com.wangbin.acquisition.core.convert;

import java.util.Map;

/**
 * 原始值到工程量的转换边界
 */
public interface ValueConverter {

    Map<String, Object> convert(String moduleType, Map<String, Object> rawValues);
}
