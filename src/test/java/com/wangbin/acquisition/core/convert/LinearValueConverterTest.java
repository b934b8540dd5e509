package com.wangbin.acquisition.core.convert;

import com.wangbin.acquisition.core.config.AcquisitionProperties.ConversionRule;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LinearValueConverterTest {

    @Test
    void appliesScaleOffsetAndPrecisionPerModule() {
        ConversionRule weight = new ConversionRule();
        weight.setScale(0.001);
        weight.setPrecision(2);
        ConversionRule temperature = new ConversionRule();
        temperature.setScale(0.1);
        temperature.setOffset(-40);
        LinearValueConverter converter = new LinearValueConverter(
                Map.of("hopper_sensor", Map.of("weight", weight, "temperature", temperature)));

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("weight", 12346);
        raw.put("temperature", 650.0);
        raw.put("running", true);
        raw.put("status", 3);

        Map<String, Object> converted = converter.convert("hopper_sensor", raw);

        assertEquals(12.35, (Double) converted.get("weight"), 1e-9);
        assertEquals(25.0, (Double) converted.get("temperature"), 1e-9);
        assertEquals(true, converted.get("running"));
        assertEquals(3, converted.get("status"));
    }

    @Test
    void unknownModulePassesValuesThrough() {
        LinearValueConverter converter = new LinearValueConverter(null);

        Map<String, Object> converted = converter.convert("unknown", Map.of("temp", 1.5));

        assertEquals(Map.of("temp", 1.5), converted);
    }
}
