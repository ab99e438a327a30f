package com.bluecats.loop.sdk.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/** Canonical timestamp format used in Loop query strings. */
public final class LoopTimestamps {

    /** Millisecond-precision UTC, e.g. {@code 2024-03-01T12:30:05.250Z}. */
    public static final String TIMESTAMP_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern(TIMESTAMP_FORMAT).withZone(ZoneOffset.UTC);

    private LoopTimestamps() {}

    public static String format(Instant instant) {
        return FORMATTER.format(instant);
    }
}
