package com.wobble.output.report;

import java.time.Duration;
import java.util.Locale;

/**
 * Formatting of unit and run durations for reports.
 */
public final class Durations {

    private Durations() {}

    /** Seconds with millisecond precision, e.g. {@code 0.012s}. */
    public static String format(Duration duration) {
        return String.format(Locale.ROOT, "%.3fs", seconds(duration));
    }

    public static double seconds(Duration duration) {
        return duration.toNanos() / 1_000_000_000.0;
    }

    /** Rounds to three decimals for structured output. */
    public static double roundedSeconds(Duration duration) {
        return Math.round(seconds(duration) * 1000.0) / 1000.0;
    }
}
