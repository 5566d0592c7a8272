package com.wobble.core.events;

import com.wobble.core.model.TestUnit;

import java.time.Instant;

public record TestStarted(TestUnit unit, Instant timestamp) implements ExecutionEvent {

    @Override
    public EventType type() {
        return EventType.TEST_STARTED;
    }
}
