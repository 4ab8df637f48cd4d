package com.phillippitts.labreasoning.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} based timings of model calls and layers.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return whole milliseconds elapsed since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
