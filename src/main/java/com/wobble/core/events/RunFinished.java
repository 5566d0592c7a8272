package com.wobble.core.events;

import com.wobble.core.model.RunSummary;

import java.time.Instant;

public record RunFinished(String runId, RunSummary summary, Instant timestamp) implements ExecutionEvent {

    @Override
    public EventType type() {
        return EventType.RUN_FINISHED;
    }
}
