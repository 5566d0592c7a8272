package com.wobble.output.file;

import com.wobble.core.events.ExecutionEvent;
import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestUnit;
import com.wobble.core.model.TimingProfile;
import com.wobble.output.report.Durations;

import java.util.Locale;

/**
 * Plain-text entries, one per event: a header line starting in the first column, followed by detail
 * lines indented by four spaces.
 * <p>
 * Level 1 gives status and name, level 2 adds timing and unit metadata, level 3 adds the error
 * message, file location and stack trace.
 */
class TextEventSerializer implements EventSerializer {

    static final String INDENT = "    ";

    private final int level;

    TextEventSerializer(int level) {
        if (level < 1 || level > 3) {
            throw new IllegalArgumentException("Text verbosity must be between 1 and 3 but was " + level);
        }
        this.level = level;
    }

    @Override
    public String serialize(ExecutionEvent event) {
        StringBuilder entry = new StringBuilder();
        if (event instanceof RunStarted started) {
            renderRunStarted(started, entry);
        } else if (event instanceof TestStarted started) {
            entry.append("START ").append(started.unit().id());
        } else if (event instanceof TestFinished finished) {
            renderTestFinished(finished, entry);
        } else if (event instanceof RunFinished finished) {
            renderRunFinished(finished, entry);
        } else {
            entry.append(event.type());
        }
        return entry.toString();
    }

    private void renderRunStarted(RunStarted started, StringBuilder entry) {
        entry.append("RUN ").append(started.runId()).append(" started at ").append(started.timestamp())
                .append(" with ").append(started.plannedUnits()).append(" test(s)");
        if (level >= 2 && started.command() != null) {
            line(entry, "command: " + started.command());
        }
    }

    private void renderTestFinished(TestFinished finished, StringBuilder entry) {
        TestUnit unit = finished.unit();
        entry.append(String.format(Locale.ROOT, "%-5s ", finished.status().label())).append(unit.id());
        if (level >= 2) {
            entry.append(" (").append(Durations.format(finished.duration())).append(')');
            line(entry, metadata(unit));
        }
        if (finished.message() != null && !finished.message().isEmpty()) {
            line(entry, "message: " + finished.message());
        }
        ErrorDetail error = finished.error();
        if (level >= 3 && error != null) {
            line(entry, "error: " + error.type());
            if (error.location() != null) {
                line(entry, "location: " + error.location());
            }
            line(entry, "trace:");
            for (String traceLine : error.trace().split("\\R")) {
                if (!traceLine.isBlank()) {
                    entry.append(System.lineSeparator()).append(INDENT).append(INDENT).append(traceLine.strip());
                }
            }
        }
    }

    private void renderRunFinished(RunFinished finished, StringBuilder entry) {
        RunSummary summary = finished.summary();
        entry.append("SUMMARY ").append(finished.runId()).append(summary.interrupted() ? " interrupted" : " finished");
        line(entry, String.format(Locale.ROOT, "tests run: %d, passed: %d, failures: %d, errors: %d, skipped: %d",
                summary.testsRun(), summary.passed(), summary.failed(), summary.errored(), summary.skipped()));
        line(entry, String.format(Locale.ROOT, "success rate: %.1f%%", summary.successRate()));
        line(entry, "total time: " + Durations.format(summary.elapsed()));
        TimingProfile timings = summary.timings();
        if (level >= 2 && !timings.isEmpty()) {
            line(entry, "fastest: " + timings.fastestUnit() + " (" + Durations.format(timings.fastest()) + ")");
            line(entry, "slowest: " + timings.slowestUnit() + " (" + Durations.format(timings.slowest()) + ")");
            line(entry, "average: " + Durations.format(timings.average()));
        }
    }

    private static String metadata(TestUnit unit) {
        StringBuilder text = new StringBuilder("category: ").append(unit.category().id());
        unit.scopeLabel().ifPresent(scope -> text.append(", scope: ").append(scope));
        unit.phaseLabel().ifPresent(phase -> text.append(", phase: ").append(phase));
        if (unit.slow()) text.append(", slow");
        if (unit.skipCi()) text.append(", skip-ci");
        text.append(", source: ").append(unit.source());
        return text.toString();
    }

    /** Appends an indented detail line; embedded line breaks stay inside the entry. */
    private static void line(StringBuilder entry, String text) {
        for (String part : text.split("\\R")) {
            if (!part.isBlank()) {
                entry.append(System.lineSeparator()).append(INDENT).append(part);
            }
        }
    }
}
