package com.wangbin.acquisition.core.store;

import com.wangbin.acquisition.common.domain.entity.BatchPoint;
import com.wangbin.acquisition.common.exception.AcquisitionException;
import com.wangbin.acquisition.core.config.AcquisitionProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InfluxDbTimeSeriesStoreTest {

    private static final BatchPoint POINT =
            new BatchPoint("sensor_data", Map.of("device_id", "hopper_1"), Map.of("weight", 12.5), 1L);

    @Test
    void invalidTokenBecomesRetryableStoreError() {
        AcquisitionProperties.Store config = new AcquisitionProperties.Store();
        config.setUrl("http://127.0.0.1:9");
        config.setToken("abc\n");
        InfluxDbTimeSeriesStore store = new InfluxDbTimeSeriesStore(config);

        AcquisitionException error = assertThrows(AcquisitionException.class, () -> store.writeBatch(List.of(POINT)));

        assertEquals(AcquisitionException.Kind.STORE_WRITE, error.getKind());
        assertTrue(error.isRetryable());
        assertFalse(error.isRejected());
    }

    @Test
    void onlyDataErrorsCountAsRejection() {
        assertTrue(InfluxDbTimeSeriesStore.isDataRejection(400));
        assertTrue(InfluxDbTimeSeriesStore.isDataRejection(422));
        assertFalse(InfluxDbTimeSeriesStore.isDataRejection(401));
        assertFalse(InfluxDbTimeSeriesStore.isDataRejection(503));
    }

    @Test
    void emptyBatchSkipsRequest() {
        AcquisitionProperties.Store config = new AcquisitionProperties.Store();
        config.setToken("abc\n");

        assertDoesNotThrow(() -> new InfluxDbTimeSeriesStore(config).writeBatch(List.of()));
    }
}
