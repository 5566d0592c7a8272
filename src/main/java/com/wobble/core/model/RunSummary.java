package com.wobble.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Aggregate outcome of one run. Computed once when the run finishes.
 *
 * @param passed      units that passed
 * @param failed      units with an assertion mismatch
 * @param errored     units with an unexpected fault (load failures included)
 * @param skipped     units that were skipped
 * @param startedAt   when the run started
 * @param finishedAt  when the run finished
 * @param elapsed     total wall time
 * @param interrupted whether the run was cancelled before all selected units ran
 * @param timings     per-unit timing profile
 */
public record RunSummary(
    int passed,
    int failed,
    int errored,
    int skipped,
    Instant startedAt,
    Instant finishedAt,
    Duration elapsed,
    boolean interrupted,
    TimingProfile timings
) {

    public RunSummary {
        if (passed < 0 || failed < 0 || errored < 0 || skipped < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
    }

    public int testsRun() {
        return passed + failed + errored + skipped;
    }

    /**
     * Percentage of non-skipped units that passed; 100 when every unit was skipped or none ran.
     */
    public double successRate() {
        int considered = testsRun() - skipped;
        if (considered == 0) return 100.0;
        return 100.0 * passed / considered;
    }

    public boolean hasProblems() {
        return failed > 0 || errored > 0;
    }

    public int count(TestStatus status) {
        return switch (status) {
            case PASSED -> passed;
            case FAILED -> failed;
            case ERRORED -> errored;
            case SKIPPED -> skipped;
        };
    }
}
