package com.wobble.output.console;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.output.report.JsonReport;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers the run and prints one JSON document when it finishes.
 */
class JsonRenderer implements ConsoleRenderer {

    private final PrintStream out;
    private final JsonReport report;
    private final List<ObjectNode> results = new ArrayList<>();
    private ObjectNode runInfo;

    JsonRenderer(PrintStream out, JsonReport report) {
        this.out = out;
        this.report = report;
    }

    @Override
    public void runStarted(RunStarted event) {
        runInfo = report.runInfo(event);
    }

    @Override
    public void testStarted(TestStarted event) {
    }

    @Override
    public void testFinished(TestFinished event) {
        if (report.includesResults()) {
            results.add(report.result(event));
        }
    }

    @Override
    public void runFinished(RunFinished event) {
        out.println(report.toJson(report.document(runInfo, results, event.summary())));
        out.flush();
        results.clear();
    }
}
