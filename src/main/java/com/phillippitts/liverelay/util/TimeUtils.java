package com.phillippitts.liverelay.util;

import java.time.Instant;

/**
 * Time helpers for latency measurement and wire timestamps.
 *
 * @since 1.0
 */
public final class TimeUtils {

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} reading.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Converts an instant to fractional seconds since the epoch, the timestamp format of
     * controller events (e.g. {@code 1730390400.125}).
     *
     * @param instant point in time
     * @return seconds since the epoch with millisecond precision
     */
    public static double epochSeconds(Instant instant) {
        return instant.toEpochMilli() / 1000.0;
    }
}
