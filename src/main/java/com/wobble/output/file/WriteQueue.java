package com.wobble.output.file;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.TimeUnit;

/**
 * A bounded FIFO channel between one producer and one consumer that can be closed.
 * <p>
 * Closing marks the end of the stream: nothing more can be offered, but elements already queued can
 * still be taken. The consumer learns that the stream is over when {@link #take()} returns
 * {@code null}, so its thread never has to be interrupted out of a blocking wait.
 */
public final class WriteQueue<E> {
    private final Object monitor = new Object();
    private final int capacity;
    private final Queue<E> queue;
    private boolean isClosed = false;

    private WriteQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive but was: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayDeque<>();
    }

    /**
     * @param capacity the maximum number of elements held at once
     */
    public static <E> WriteQueue<E> withCapacity(int capacity) {
        return new WriteQueue<>(capacity);
    }

    /**
     * Adds the element, waiting up to the timeout for space if the queue is full.
     *
     * @return {@code true} if the element was added, {@code false} if the timeout elapsed first
     * @throws IllegalStateException if the queue is closed
     */
    public boolean offer(E element, long timeout, TimeUnit unit) throws InterruptedException {
        if (element == null) {
            throw new NullPointerException("element must be non-null.");
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must be non-negative but was: " + timeout);
        }

        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (this.monitor) {
            long remaining = deadline - System.nanoTime();
            while (!this.isClosed && this.queue.size() == this.capacity && remaining > 0) {
                TimeUnit.NANOSECONDS.timedWait(this.monitor, remaining);
                remaining = deadline - System.nanoTime();
            }

            if (this.isClosed) {
                throw new IllegalStateException("queue is closed");
            }
            if (this.queue.size() == this.capacity) {
                return false;
            }
            this.queue.add(element);
            this.monitor.notifyAll();
            return true;
        }
    }

    /**
     * Removes the next element, waiting for one if the queue is empty.
     *
     * @return the next element, or {@code null} once the queue is closed and drained. After returning
     *         {@code null} this method always returns {@code null}.
     */
    public E take() throws InterruptedException {
        synchronized (this.monitor) {
            while (!this.isClosed && this.queue.isEmpty()) {
                this.monitor.wait();
            }
            E next = this.queue.poll();
            if (next != null) {
                this.monitor.notifyAll();
            }
            return next;
        }
    }

    /**
     * Closes the queue. Once closed it cannot be reopened.
     */
    public void close() {
        synchronized (this.monitor) {
            this.isClosed = true;
            this.monitor.notifyAll();
        }
    }

    /**
     * Drops every queued element.
     *
     * @return the number of elements dropped
     */
    public int discard() {
        synchronized (this.monitor) {
            int dropped = this.queue.size();
            this.queue.clear();
            this.monitor.notifyAll();
            return dropped;
        }
    }

    public int size() {
        synchronized (this.monitor) {
            return this.queue.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isClosed() {
        synchronized (this.monitor) {
            return this.isClosed;
        }
    }
}
