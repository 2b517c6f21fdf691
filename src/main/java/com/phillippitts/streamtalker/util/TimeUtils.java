package com.phillippitts.streamtalker.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time conversions used for latency logging and the playback delay.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Returns whether at least {@code interval} has passed between {@code since} and {@code now}.
     * A null {@code since} means nothing happened yet, which always counts as elapsed.
     */
    public static boolean hasElapsed(Instant since, Instant now, Duration interval) {
        if (since == null) {
            return true;
        }
        return !now.isBefore(since.plus(interval));
    }
}
