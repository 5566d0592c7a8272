package com.wobble.core.events;

import java.time.Instant;

/**
 * @param runId        identifier of the run
 * @param plannedUnits number of units selected for execution
 * @param command      command line that started the run
 * @param timestamp    when the run started
 */
public record RunStarted(String runId, int plannedUnits, String command, Instant timestamp)
        implements ExecutionEvent {

    @Override
    public EventType type() {
        return EventType.RUN_STARTED;
    }
}
