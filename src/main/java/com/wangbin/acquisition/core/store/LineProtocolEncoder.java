package com.wangbin.acquisition.core.store;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * InfluxDB 行协议编码，时间精度为毫秒
 */
public final class LineProtocolEncoder {

    private LineProtocolEncoder() {
    }

    public static String encode(List<BatchPoint> points) {
        StringBuilder body = new StringBuilder();
        for (BatchPoint point : points) {
            String line = encode(point);
            if (line != null) {
                if (body.length() > 0) {
                    body.append('\n');
                }
                body.append(line);
            }
        }
        return body.toString();
    }

    /**
     * 编码单个写入点，没有可写字段时返回 null
     */
    public static String encode(BatchPoint point) {
        StringBuilder fields = new StringBuilder();
        if (point.getFields() != null) {
            for (Map.Entry<String, Object> entry : point.getFields().entrySet()) {
                String value = formatFieldValue(entry.getValue());
                if (value == null) {
                    continue;
                }
                if (fields.length() > 0) {
                    fields.append(',');
                }
                fields.append(escapeKey(entry.getKey())).append('=').append(value);
            }
        }
        if (fields.length() == 0) {
            return null;
        }
        StringBuilder line = new StringBuilder(escapeMeasurement(point.getMeasurement()));
        if (point.getTags() != null) {
            // 标签按键排序
            for (Map.Entry<String, String> tag : new TreeMap<>(point.getTags()).entrySet()) {
                if (tag.getValue() == null || tag.getValue().isEmpty()) {
                    continue;
                }
                line.append(',').append(escapeKey(tag.getKey())).append('=').append(escapeKey(tag.getValue()));
            }
        }
        return line.append(' ').append(fields).append(' ').append(point.getTimestamp()).toString();
    }

    static String formatFieldValue(Object value) {
        if (value instanceof Boolean bool) {
            return bool ? "true" : "false";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return value + "i";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).toPlainString();
        }
        return null;
    }

    private static String escapeMeasurement(String value) {
        return value.replace(",", "\\,").replace(" ", "\\ ");
    }

    private static String escapeKey(String value) {
        return value.replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
    }
}
