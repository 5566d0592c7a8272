package com.wobble.output.console;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.core.events.EventSink;
import com.wobble.core.events.ExecutionEvent;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.output.report.JsonReport;

import java.io.PrintStream;

/**
 * Renders the event stream to the terminal, synchronously, with the strategy picked at construction.
 */
public class ConsoleSink implements EventSink {

    private final PrintStream out;
    private final ConsoleRenderer renderer;

    ConsoleSink(PrintStream out, ConsoleRenderer renderer) {
        this.out = out;
        this.renderer = renderer;
    }

    public static ConsoleSink create(ConsoleOptions options, PrintStream out, ObjectMapper objectMapper) {
        ConsoleRenderer renderer = switch (options.format()) {
            case STANDARD -> new StandardRenderer(out, options.ansi(), false, options.quiet());
            case VERBOSE -> new StandardRenderer(out, options.ansi(), true, options.quiet());
            case JSON -> new JsonRenderer(out, new JsonReport(objectMapper, options.jsonLevel()));
            case MINIMAL -> new MinimalRenderer(out, options.ansi());
        };
        return new ConsoleSink(out, renderer);
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        switch (event.type()) {
            case RUN_STARTED -> renderer.runStarted((RunStarted) event);
            case TEST_STARTED -> renderer.testStarted((TestStarted) event);
            case TEST_FINISHED -> renderer.testFinished((TestFinished) event);
            case RUN_FINISHED -> renderer.runFinished((RunFinished) event);
        }
    }

    @Override
    public void close() {
        out.flush();
    }
}
