package io.zynox.memory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * UTC timestamps as stored and served: ISO-8601 with fixed microsecond precision and a 'Z' suffix,
 * e.g. {@code 2025-03-01T09:30:00.000000Z}. The fixed width keeps text ordering chronological.
 */
public final class Timestamps {

    private static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    public static Instant parse(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
