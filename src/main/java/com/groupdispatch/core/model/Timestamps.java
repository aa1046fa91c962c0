package com.groupdispatch.core.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-width ISO-8601 timestamps ({@code 2026-01-31T09:15:02.117Z}).
 * <p>
 * Watermarks compare timestamps as strings, so every stored timestamp must use this
 * exact width. {@link #next()} hands out strictly increasing values so two messages
 * ingested in the same millisecond never share a watermark position.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final AtomicLong LAST_ISSUED = new AtomicLong();

    private Timestamps() {}

    public static String format(Instant instant) {
        return FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    public static String now() {
        return format(Instant.now());
    }

    /**
     * Normalizes any ISO-8601 instant to the fixed-width form.
     *
     * @throws java.time.format.DateTimeParseException if the value is not an ISO instant
     */
    public static String normalize(String isoInstant) {
        return format(Instant.parse(isoInstant));
    }

    public static Instant parse(String timestamp) {
        return Instant.parse(timestamp);
    }

    /**
     * Returns a timestamp strictly greater than any previously returned by this method.
     */
    public static String next() {
        long now = System.currentTimeMillis();
        long issued = LAST_ISSUED.updateAndGet(last -> Math.max(last + 1, now));
        return format(Instant.ofEpochMilli(issued));
    }
}
