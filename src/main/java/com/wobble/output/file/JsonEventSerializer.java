package com.wobble.output.file;

import com.wobble.core.events.ExecutionEvent;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.output.report.JsonReport;

import java.util.List;

/**
 * Serializes the parts of the structured report that each event contributes.
 * <p>
 * RunStarted yields the {@code run_info} object and TestFinished one result object (empty below level
 * 2); the final document is assembled from the summary by {@link JsonLayout} on the writer thread.
 */
class JsonEventSerializer implements EventSerializer {

    private final JsonReport report;

    JsonEventSerializer(JsonReport report) {
        this.report = report;
    }

    @Override
    public String serialize(ExecutionEvent event) {
        if (event instanceof RunStarted started) {
            return report.runInfo(started).toString();
        }
        if (event instanceof TestFinished finished && report.includesResults()) {
            return report.result(finished).toString();
        }
        if (event instanceof RunFinished finished) {
            return report.toJson(report.document(null, List.of(), finished.summary()));
        }
        return "";
    }
}
