package com.wobble.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans every execution event out to the registered sinks.
 * <p>
 * Delivery is synchronous and follows registration order; {@link #publish} returns only after every
 * sink has seen the event. A sink that throws is logged and skipped for that event without affecting
 * the others.
 */
public class EventBroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcastHub.class);

    private final CopyOnWriteArrayList<EventSink> sinks = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all registered sinks.
     *
     * @param event the event to publish
     */
    public void publish(ExecutionEvent event) {
        log.trace("Publishing {} to {} sink(s)", event.type(), sinks.size());
        for (EventSink sink : sinks) {
            deliverSafely(sink, event);
        }
    }

    /**
     * Register a sink after the ones already registered.
     *
     * @param sink the sink to add
     * @return a {@link Subscription} handle to unregister later
     */
    public Subscription register(EventSink sink) {
        sinks.add(sink);
        log.debug("Registered sink {}", sink.getClass().getSimpleName());
        return () -> sinks.remove(sink);
    }

    public List<EventSink> sinks() {
        return List.copyOf(sinks);
    }

    /**
     * Close every sink in registration order. A sink failing to close does not stop the others.
     */
    public void closeAll() {
        for (EventSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                log.warn("Sink {} failed to close: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Handle for cancelling a registration.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(EventSink sink, ExecutionEvent event) {
        try {
            sink.onEvent(event);
        } catch (Exception e) {
            log.warn("Sink {} threw exception processing event {}: {}",
                    sink.getClass().getSimpleName(), event.type(), e.getMessage(), e);
        }
    }
}
