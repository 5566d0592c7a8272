package com.wobble.output.file;

import com.wobble.core.events.ExecutionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Persists an event stream to one file from a dedicated worker thread.
 * <p>
 * The producing thread serializes each event, numbers it and hands it to a bounded {@link WriteQueue};
 * the worker takes jobs in FIFO order and is the only thread that touches the file. When the queue is
 * full, {@link #submit} waits in slices of the configured enqueue wait and logs a backpressure warning
 * after each slice; jobs are never dropped to make room.
 * <p>
 * I/O faults, and runtime faults from the record layout, are caught on the worker, reported once through the fault reporter and end all further
 * writing; the jobs that follow are drained and counted as discarded so the producer never blocks on a
 * dead consumer.
 */
public class BackgroundFileWriter {

    private static final Logger log = LoggerFactory.getLogger(BackgroundFileWriter.class);

    public static final String THREAD_NAME = "wobble-file-writer";

    private final Path target;
    private final WriteMode mode;
    private final EventSerializer serializer;
    private final RecordLayout layout;
    private final WriteQueue<WriteJob> queue;
    private final Duration enqueueWait;
    private final Consumer<String> faultReporter;
    private final Thread worker;
    private final CountDownLatch finished = new CountDownLatch(1);

    private final AtomicLong written = new AtomicLong();
    private final AtomicLong discarded = new AtomicLong();
    private final AtomicReference<String> fault = new AtomicReference<>();
    private volatile boolean abandoned;

    // producer side only
    private long nextSequence = 1;
    private ShutdownReport shutdownReport;

    /**
     * Starts the worker, which opens the target according to {@code mode}.
     *
     * @param capacity      maximum number of queued jobs
     * @param enqueueWait   length of one backpressure wait slice
     * @param faultReporter receives a one-line message for the first I/O fault and for an abandoned shutdown
     */
    public BackgroundFileWriter(Path target, WriteMode mode, EventSerializer serializer, RecordLayout layout,
                                int capacity, Duration enqueueWait, Consumer<String> faultReporter) {
        this.target = target;
        this.mode = mode;
        this.serializer = serializer;
        this.layout = layout;
        this.queue = WriteQueue.withCapacity(capacity);
        this.enqueueWait = enqueueWait;
        this.faultReporter = faultReporter;
        this.worker = new Thread(this::drain, THREAD_NAME);
        this.worker.setDaemon(true);
        this.worker.start();
        log.debug("File writer started for {} ({})", target, mode);
    }

    public Path target() {
        return target;
    }

    /**
     * Queues the event for writing. Must be called from a single producing thread.
     *
     * @throws IllegalStateException after {@link #shutdown}
     */
    public void submit(ExecutionEvent event) {
        if (shutdownReport != null || queue.isClosed()) {
            throw new IllegalStateException("File writer for " + target + " is shut down");
        }
        WriteJob job = new WriteJob(nextSequence++, event.type(), serializer.serialize(event));
        long waitMillis = Math.max(1, enqueueWait.toMillis());
        try {
            while (!queue.offer(job, waitMillis, TimeUnit.MILLISECONDS)) {
                if (!worker.isAlive()) {
                    discarded.incrementAndGet();
                    log.error("File writer thread for {} is gone; event #{} not written", target, job.sequence());
                    return;
                }
                log.warn("File output queue for {} is full ({} jobs); still waiting to enqueue event #{}",
                        target, queue.size(), job.sequence());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discarded.incrementAndGet();
            log.warn("Interrupted while enqueueing event #{} for {}; event not written", job.sequence(), target);
        }
    }

    /**
     * Ends the stream and waits up to {@code timeout} for the worker to write what is queued and close
     * the file. When the timeout elapses the remaining jobs are abandoned. Calling it again returns the
     * first report.
     */
    public ShutdownReport shutdown(Duration timeout) {
        if (shutdownReport != null) {
            return shutdownReport;
        }
        queue.close();

        boolean completed = awaitWorker(timeout);
        if (completed) {
            // only left over when the worker died early
            discarded.addAndGet(queue.discard());
        } else {
            abandoned = true;
            int dropped = queue.discard();
            discarded.addAndGet(dropped);
            String message = "File output to " + target + " did not finish within " + timeout.toMillis()
                    + "ms; " + dropped + " pending event(s) abandoned";
            log.warn(message);
            faultReporter.accept(message);
        }

        shutdownReport = new ShutdownReport(target, completed, written.get(), discarded.get(), fault.get());
        log.debug("File writer for {} shut down: {}", target, shutdownReport);
        return shutdownReport;
    }

    /**
     * Waits for the worker for the whole timeout even if the calling thread is interrupted, so an
     * interrupted caller still gets a drained file. The interrupt flag is restored before returning.
     */
    private boolean awaitWorker(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return finished.await(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void drain() {
        Writer out = null;
        try {
            out = open();
        } catch (IOException e) {
            recordFault("open", e);
        }

        long expected = 1;
        try {
            WriteJob job;
            while ((job = queue.take()) != null) {
                if (abandoned) {
                    discarded.addAndGet(1 + queue.discard());
                    break;
                }
                if (job.sequence() != expected) {
                    log.error("File output for {} received event #{} but expected #{}", target, job.sequence(), expected);
                }
                expected = job.sequence() + 1;
                if (out == null || fault.get() != null) {
                    discarded.incrementAndGet();
                    continue;
                }
                try {
                    layout.write(job, out);
                    written.incrementAndGet();
                    if (queue.isEmpty()) {
                        out.flush();
                    }
                } catch (IOException | RuntimeException e) {
                    recordFault("write", e);
                    discarded.incrementAndGet();
                }
            }
            if (out != null && fault.get() == null && !abandoned) {
                layout.finish(out);
            }
        } catch (IOException | RuntimeException e) {
            recordFault("finish", e);
            discarded.addAndGet(queue.discard());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            discarded.addAndGet(queue.discard());
            log.warn("File writer for {} interrupted; remaining events dropped", target);
        } finally {
            close(out);
            finished.countDown();
        }
    }

    private Writer open() throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return Files.newBufferedWriter(target, StandardCharsets.UTF_8, mode.openOptions());
    }

    private void close(Writer out) {
        if (out == null) return;
        try {
            out.close();
        } catch (IOException e) {
            recordFault("close", e);
        }
    }

    private void recordFault(String operation, Exception e) {
        String message = "Failed to " + operation + " " + target + ": "
                + (e instanceof IOException ? e.getMessage() : e.toString());
        if (fault.compareAndSet(null, message)) {
            log.error("File output fault, further events for {} are discarded", target, e);
            faultReporter.accept(message);
        } else {
            log.debug("Additional file output fault on {}", target, e);
        }
    }
}
