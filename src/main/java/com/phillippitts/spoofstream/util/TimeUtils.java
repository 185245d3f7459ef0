package com.phillippitts.spoofstream.util;

import java.time.Instant;

/**
 * Utility methods for latency measurement and wire timestamps.
 *
 * <p>Latency is measured with {@link System#nanoTime()}; wall-clock instants go on the wire
 * as epoch seconds with millisecond precision.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * classifier.classify(window, rate);
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Converts an instant to fractional epoch seconds, e.g. {@code 1718000000.123}.
     *
     * @param instant instant to convert; {@code null} is treated as now
     */
    public static double epochSeconds(Instant instant) {
        Instant at = instant == null ? Instant.now() : instant;
        return at.toEpochMilli() / 1000.0;
    }

    /** Current wall-clock time as fractional epoch seconds. */
    public static double nowEpochSeconds() {
        return epochSeconds(Instant.now());
    }
}
