package com.wobble.core.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a run. Set from any thread; checked by the execution engine
 * before each unit.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Requests cancellation.
     *
     * @return {@code true} if this call cancelled the token, {@code false} if it already was
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
