package com.wobble.core.engine;

import com.wobble.core.events.TestFinished;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TimingProfile;

import java.time.Duration;
import java.time.Instant;

/**
 * Tallies finished units while a run executes. Confined to the executing thread.
 */
final class SummaryAccumulator {

    private int passed;
    private int failed;
    private int errored;
    private int skipped;

    private String fastestUnit;
    private Duration fastest = Duration.ZERO;
    private String slowestUnit;
    private Duration slowest = Duration.ZERO;
    private Duration total = Duration.ZERO;

    void record(TestFinished finished) {
        switch (finished.status()) {
            case PASSED -> passed++;
            case FAILED -> failed++;
            case ERRORED -> errored++;
            case SKIPPED -> skipped++;
        }

        Duration duration = finished.duration();
        String name = finished.unit().displayName();
        if (fastestUnit == null || duration.compareTo(fastest) < 0) {
            fastestUnit = name;
            fastest = duration;
        }
        if (slowestUnit == null || duration.compareTo(slowest) > 0) {
            slowestUnit = name;
            slowest = duration;
        }
        total = total.plus(duration);
    }

    int completed() {
        return passed + failed + errored + skipped;
    }

    RunSummary summarize(Instant startedAt, Instant finishedAt, Duration elapsed, boolean interrupted) {
        int count = completed();
        TimingProfile timings = count == 0
                ? TimingProfile.EMPTY
                : new TimingProfile(fastestUnit, fastest, slowestUnit, slowest, total.dividedBy(count));
        return new RunSummary(passed, failed, errored, skipped, startedAt, finishedAt, elapsed, interrupted, timings);
    }
}
