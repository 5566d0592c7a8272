package com.wobble.core.events;

/**
 * A destination for the execution event stream.
 * <p>
 * {@link #onEvent} is called on the executing thread, in event order; implementations must not
 * reorder, drop or duplicate events, though they may buffer before writing.
 */
public interface EventSink {

    void onEvent(ExecutionEvent event);

    /**
     * Flushes and releases the sink. Called once after the last event.
     */
    default void close() {
    }
}
