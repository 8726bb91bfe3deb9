package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EventIdGenerator")
class EventIdGeneratorTest {

    @Test
    @DisplayName("Ids are {category}_{millis base36}_{6 chars}")
    void testNext_Format() {
        Instant now = Instant.parse("2026-01-30T12:00:00Z");
        String id = new EventIdGenerator().next(EventCategory.AIR_POLLUTION, now);

        String[] parts = id.split("_");
        assertEquals(3, parts.length);
        assertEquals("air-pollution", parts[0]);
        assertEquals(Long.toString(now.toEpochMilli(), 36), parts[1]);
        assertTrue(parts[2].matches("[0-9a-z]{6}"));
    }

    @Test
    @DisplayName("Ids generated at the same instant differ")
    void testNext_Unique() {
        EventIdGenerator generator = new EventIdGenerator();
        Instant now = Instant.parse("2026-01-30T12:00:00Z");
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            ids.add(generator.next(EventCategory.FIRE, now));
        }
        assertEquals(200, ids.size());
    }
}
