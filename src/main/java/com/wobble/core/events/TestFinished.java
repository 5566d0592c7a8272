package com.wobble.core.events;

import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.TestStatus;
import com.wobble.core.model.TestUnit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one unit.
 *
 * @param unit      the unit that ran
 * @param status    translated status
 * @param duration  wall-clock time spent executing the unit
 * @param message   failure message or skip reason, {@code null} for passing units
 * @param error     captured throwable for failed and errored units, {@code null} otherwise
 * @param timestamp when the unit finished
 */
public record TestFinished(
    TestUnit unit,
    TestStatus status,
    Duration duration,
    String message,
    ErrorDetail error,
    Instant timestamp
) implements ExecutionEvent {

    @Override
    public EventType type() {
        return EventType.TEST_FINISHED;
    }

    /** Full trace text, or {@code null} when nothing was thrown. */
    public String trace() {
        return error == null ? null : error.trace();
    }
}
