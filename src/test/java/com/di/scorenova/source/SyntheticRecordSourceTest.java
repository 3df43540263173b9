package com.di.scorenova.source;

import com.di.scorenova.pipeline.InputRecord;
import com.di.scorenova.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SyntheticRecordSource Tests")
class SyntheticRecordSourceTest {

    private final MutableClock clock = MutableClock.at("2024-06-01T12:00:00Z");

    @Test
    @DisplayName("Should generate hourly readings per equipment within their ranges")
    void testLoadBatch_ShapeAndRanges() {
        List<InputRecord> batch = new SyntheticRecordSource(3, 42L, clock).loadBatch();

        assertEquals(3, batch.size());
        assertEquals("EQ0001", batch.get(0).getEquipmentId());
        assertEquals("EQ0003", batch.get(2).getEquipmentId());
        assertEquals(Instant.parse("2024-06-01T12:00:00Z"), batch.get(0).getTimestamp());
        assertEquals(Instant.parse("2024-06-01T10:00:00Z"), batch.get(2).getTimestamp());
        for (InputRecord r : batch) {
            double temperature = r.getFields().get("temperature");
            double rpm = r.getFields().get("rpm");
            assertTrue(temperature >= 20 && temperature < 50);
            assertTrue(rpm >= 1000 && rpm < 3000);
            assertEquals(5, r.getFields().size());
        }
    }

    @Test
    @DisplayName("Should be reproducible with a seed")
    void testLoadBatch_Seeded() {
        assertEquals(new SyntheticRecordSource(5, 7L, clock).loadBatch(),
                     new SyntheticRecordSource(5, 7L, clock).loadBatch());
    }

    @Test
    @DisplayName("Should reject a non-positive batch size")
    void testConstructor_InvalidCount() {
        assertThrows(IllegalArgumentException.class, () -> new SyntheticRecordSource(0, null, clock));
    }
}
