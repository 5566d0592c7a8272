package com.wobble.output.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.core.events.EventSink;
import com.wobble.core.events.ExecutionEvent;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * Sink that hands every event to its own {@link BackgroundFileWriter}.
 * Closing the sink runs the writer's shutdown protocol.
 */
public class FileSink implements EventSink {

    private final BackgroundFileWriter writer;
    private final Duration shutdownTimeout;
    private volatile ShutdownReport report;

    public FileSink(BackgroundFileWriter writer, Duration shutdownTimeout) {
        this.writer = writer;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Opens a writer for the requested file output.
     *
     * @param output        target, format, verbosity and mode
     * @param capacity      writer queue capacity
     * @param enqueueWait   backpressure wait slice
     * @param shutdownTimeout how long {@link #close()} waits for the writer
     * @param faultReporter receives writer faults for the console
     */
    public static FileSink open(FileOutput output, ObjectMapper objectMapper, int capacity, Duration enqueueWait,
                                Duration shutdownTimeout, Consumer<String> faultReporter) {
        BackgroundFileWriter writer = new BackgroundFileWriter(output.target(), output.mode(),
                output.format().serializer(output.verbosity(), objectMapper),
                output.format().layout(output.verbosity(), objectMapper),
                capacity, enqueueWait, faultReporter);
        return new FileSink(writer, shutdownTimeout);
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        writer.submit(event);
    }

    @Override
    public void close() {
        report = writer.shutdown(shutdownTimeout);
    }

    /** The shutdown report, or {@code null} before {@link #close()}. */
    public ShutdownReport report() {
        return report;
    }

    public BackgroundFileWriter writer() {
        return writer;
    }
}
