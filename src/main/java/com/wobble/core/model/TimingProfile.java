package com.wobble.core.model;

import java.time.Duration;

/**
 * Fastest, slowest and average unit duration of a run.
 *
 * @param fastestUnit display name of the fastest unit, {@code null} when nothing ran
 * @param fastest     its duration
 * @param slowestUnit display name of the slowest unit, {@code null} when nothing ran
 * @param slowest     its duration
 * @param average     mean duration over all executed units
 */
public record TimingProfile(
    String fastestUnit,
    Duration fastest,
    String slowestUnit,
    Duration slowest,
    Duration average
) {

    public static final TimingProfile EMPTY =
            new TimingProfile(null, Duration.ZERO, null, Duration.ZERO, Duration.ZERO);

    public boolean isEmpty() {
        return fastestUnit == null;
    }
}
