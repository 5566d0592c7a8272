package com.wobble.dispatch.cli;

import com.wobble.core.engine.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Turns a JVM shutdown (Ctrl+C, SIGTERM) during a run into cooperative cancellation.
 * <p>
 * The shutdown hook cancels the run and then holds the JVM for at most {@code maxWait}, so that the
 * test in flight can finish, the summary can be emitted and file outputs can be drained and closed.
 */
public final class RunInterruptHandler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunInterruptHandler.class);

    private final CancellationToken token;
    private final Duration maxWait;
    private final Consumer<String> notifier;
    private final CountDownLatch completed = new CountDownLatch(1);
    private final Thread hook;

    private RunInterruptHandler(CancellationToken token, Duration maxWait, Consumer<String> notifier) {
        this.token = token;
        this.maxWait = maxWait;
        this.notifier = notifier;
        this.hook = new Thread(this::onShutdown, "wobble-interrupt");
    }

    public static RunInterruptHandler install(CancellationToken token, Duration maxWait, Consumer<String> notifier) {
        RunInterruptHandler handler = new RunInterruptHandler(token, maxWait, notifier);
        Runtime.getRuntime().addShutdownHook(handler.hook);
        return handler;
    }

    void onShutdown() {
        if (completed.getCount() == 0) return;
        if (token.cancel()) {
            notifier.accept("Interrupted: finishing the current test and closing outputs");
            log.warn("Shutdown requested during run; cancelling");
        }
        try {
            if (!completed.await(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not wind down within {}ms of the interrupt", maxWait.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Marks the pipeline as finished and removes the hook if the JVM is not already shutting down.
     */
    @Override
    public void close() {
        completed.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown in progress; interrupt hook stays registered");
        }
    }
}
