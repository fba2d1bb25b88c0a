package com.phillippitts.sermonflow.util;

import java.time.Duration;

/**
 * Time conversions for elapsed-time measurement and duration display.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Rough processing estimate: three minutes per ten minutes of audio, at least one minute.
     */
    public static Duration estimatedProcessingTime(double audioSeconds) {
        long minutes = Math.max(1L, Math.round(audioSeconds / 600.0 * 3.0));
        return Duration.ofMinutes(minutes);
    }

    /** Whole seconds, truncated toward zero. */
    public static int wholeSeconds(double seconds) {
        return (int) Math.max(0, Math.floor(seconds));
    }
}
