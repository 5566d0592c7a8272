package com.wobble.core.events;

import java.time.Instant;

/**
 * An event emitted while a run executes. Implementations are immutable records; every sink
 * receives the same instance.
 *
 * @see RunStarted
 * @see TestStarted
 * @see TestFinished
 * @see RunFinished
 */
public interface ExecutionEvent {

    EventType type();

    Instant timestamp();
}
