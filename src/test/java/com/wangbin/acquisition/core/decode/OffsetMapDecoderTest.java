package com.wangbin.acquisition.core.decode;

import com.wangbin.acquisition.common.enums.DataType;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties.DeviceDefinition;
import com.wangbin.acquisition.core.config.AcquisitionProperties.FieldDefinition;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OffsetMapDecoderTest {

    private final OffsetMapDecoder decoder = new OffsetMapDecoder();

    @Test
    void decodesBigEndianValuesByOffset() {
        ByteBuffer buffer = ByteBuffer.allocate(19);
        buffer.putFloat(0, 812.5f);
        buffer.putShort(4, (short) -12);
        buffer.putShort(6, (short) 0xFFFE);
        buffer.putInt(8, -100_000);
        buffer.putInt(12, 0xFFFFFFFF);
        buffer.putShort(16, (short) 0);
        buffer.put(18, (byte) 0b0000_0101);
        DeviceLayout layout = new DeviceLayout("kiln_1", "辊道窑1", "roller_kiln", "kiln_zone", 2, 0, 19, List.of(
                new FieldLayout("temp", 0, DataType.FLOAT32, 0),
                new FieldLayout("delta", 4, DataType.INT16, 0),
                new FieldLayout("status", 6, DataType.UINT16, 0),
                new FieldLayout("offset_total", 8, DataType.INT32, 0),
                new FieldLayout("energy", 12, DataType.UINT32, 0),
                new FieldLayout("running", 18, DataType.BOOL, 0),
                new FieldLayout("alarm", 18, DataType.BOOL, 1),
                new FieldLayout("ready", 18, DataType.BOOL, 2)));

        Map<String, Object> values = decoder.decode(buffer.array(), layout);

        assertEquals(812.5, (Double) values.get("temp"), 1e-6);
        assertEquals(-12, values.get("delta"));
        assertEquals(65534, values.get("status"));
        assertEquals(-100_000, values.get("offset_total"));
        assertEquals(4294967295L, values.get("energy"));
        assertEquals(true, values.get("running"));
        assertEquals(false, values.get("alarm"));
        assertEquals(true, values.get("ready"));
        assertEquals(List.of("temp", "delta", "status", "offset_total", "energy", "running", "alarm", "ready"),
                List.copyOf(values.keySet()));
    }

    @Test
    void fieldBeyondBlockIsDecodeError() {
        DeviceLayout layout = new DeviceLayout("hopper_1", null, "hopper", "hopper_sensor", 1, 0, 4, List.of(
                new FieldLayout("weight", 2, DataType.FLOAT32, 0)));

        AcquisitionException error = assertThrows(AcquisitionException.class,
                () -> decoder.decode(new byte[4], layout));

        assertEquals(AcquisitionException.Kind.DECODE, error.getKind());
        assertEquals("hopper_1", error.getDeviceId());
        assertFalse(error.isRetryable());
    }

    @Test
    void layoutFromDefinitionDerivesSizeFromFields() {
        DeviceDefinition definition = new DeviceDefinition();
        definition.setDeviceId("hopper_1");
        definition.setBlockId(1);
        definition.setOffset(16);
        FieldDefinition weight = new FieldDefinition();
        weight.setName("weight");
        weight.setOffset(4);
        weight.setType("REAL");
        FieldDefinition status = new FieldDefinition();
        status.setName("status");
        status.setOffset(8);
        status.setType("WORD");
        definition.setFields(List.of(weight, status));

        DeviceLayout layout = DeviceLayout.from(definition);

        assertEquals(10, layout.getSize());
        assertEquals(16, layout.getOffset());
        assertEquals(DataType.FLOAT32, layout.getFields().get(0).dataType());
        assertEquals(DataType.UINT16, layout.getFields().get(1).dataType());
    }
}
