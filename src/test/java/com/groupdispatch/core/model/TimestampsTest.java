package com.groupdispatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimestampsTest {

    @Test
    @DisplayName("formats to fixed width so string order matches time order")
    void fixedWidth() {
        assertEquals("2026-01-01T00:00:00.000Z", Timestamps.format(Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals("2026-01-01T00:00:00.123Z", Timestamps.normalize("2026-01-01T00:00:00.123456Z"));
        assertTrue(Timestamps.normalize("2026-01-01T00:00:00Z")
                .compareTo(Timestamps.normalize("2026-01-01T00:00:00.001Z")) < 0);
    }

    @Test
    @DisplayName("next never repeats a value")
    void strictlyIncreasing() {
        String previous = Timestamps.next();
        for (int i = 0; i < 1000; i++) {
            String current = Timestamps.next();
            assertTrue(current.compareTo(previous) > 0, current + " after " + previous);
            previous = current;
        }
    }
}
