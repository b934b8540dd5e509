package com.wangbin.acquisition.core.convert;

import com.wangbin.acquisition.core.config.AcquisitionProperties.ConversionRule;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 线性换算：value * scale + offset，按模块类型配置规则；没有规则的字段原样保留
 */
public class LinearValueConverter implements ValueConverter {

    private final Map<String, Map<String, ConversionRule>> rules;

    public LinearValueConverter(Map<String, Map<String, ConversionRule>> rules) {
        this.rules = rules != null ? rules : Collections.emptyMap();
    }

    @Override
    public Map<String, Object> convert(String moduleType, Map<String, Object> rawValues) {
        Map<String, ConversionRule> moduleRules = moduleType == null
                ? Collections.emptyMap()
                : rules.getOrDefault(moduleType, Collections.emptyMap());
        Map<String, Object> converted = new LinkedHashMap<>();
        rawValues.forEach((name, value) -> {
            ConversionRule rule = moduleRules.get(name);
            if (rule == null || !(value instanceof Number number)) {
                converted.put(name, value);
            } else {
                converted.put(name, apply(rule, number.doubleValue()));
            }
        });
        return converted;
    }

    private double apply(ConversionRule rule, double raw) {
        double value = raw * rule.getScale() + rule.getOffset();
        if (rule.getPrecision() < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(rule.getPrecision(), RoundingMode.HALF_UP).doubleValue();
    }
}
