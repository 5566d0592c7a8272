package com.wobble.output.file;

import com.wobble.core.events.ExecutionEvent;

/**
 * Renders an event into the payload of a {@link WriteJob}. Runs on the producing thread.
 */
@FunctionalInterface
public interface EventSerializer {

    String serialize(ExecutionEvent event);
}
