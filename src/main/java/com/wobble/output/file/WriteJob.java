package com.wobble.output.file;

import com.wobble.core.events.EventType;

/**
 * One serialized event queued for the file writer.
 *
 * @param sequence position in the event stream, starting at 1 and increasing by one per job
 * @param type     type of the serialized event
 * @param payload  the event, already rendered by the writer's {@link EventSerializer}
 */
public record WriteJob(long sequence, EventType type, String payload) {
}
