package com.phillippitts.transcribe.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Works on timestamps taken with {@link System#nanoTime()}.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * <pre>
     * long startTime = System.nanoTime();
     * // ... do work ...
     * long elapsedMs = TimeUtils.elapsedMillis(startTime);
     * </pre>
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed seconds since a nanosecond timestamp, rounded to millisecond precision.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed seconds, e.g. {@code 1.234}
     */
    public static double elapsedSeconds(long startNanos) {
        return roundToMillis((System.nanoTime() - startNanos) / NANOS_PER_SECOND);
    }

    /**
     * Rounds a number of seconds to three decimals.
     */
    public static double roundToMillis(double seconds) {
        return Math.round(seconds * 1000.0) / 1000.0;
    }
}
