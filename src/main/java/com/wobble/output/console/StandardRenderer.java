package com.wobble.output.console;

import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestUnit;
import com.wobble.core.model.TimingProfile;
import com.wobble.output.report.Durations;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Colored line per finished unit with its timing, framed by a header and a summary block.
 * <p>
 * The verbose variant also announces each unit as it starts, prints its metadata and the full error
 * text and trace. In quiet mode only failed and errored units and the final summary line are printed.
 */
class StandardRenderer implements ConsoleRenderer {

    private static final String RULE = "──────────────────────────────────";

    private final PrintStream out;
    private final Ansi ansi;
    private final boolean verbose;
    private final boolean quiet;

    StandardRenderer(PrintStream out, Ansi ansi, boolean verbose, boolean quiet) {
        this.out = out;
        this.ansi = ansi;
        this.verbose = verbose;
        this.quiet = quiet;
    }

    @Override
    public void runStarted(RunStarted event) {
        if (quiet) return;
        out.println(ansi.string("@|bold,fg(cyan) [WOBBLE]|@ ") + "Running " + event.plannedUnits()
                + " test" + (event.plannedUnits() != 1 ? "s" : ""));
        if (verbose) {
            out.println("  run " + event.runId() + " started " + event.timestamp());
        }
        out.println(RULE);
    }

    @Override
    public void testStarted(TestStarted event) {
        if (verbose && !quiet) {
            out.println(ansi.string("  @|faint ...|@ ") + event.unit().displayName());
        }
    }

    @Override
    public void testFinished(TestFinished event) {
        if (quiet && !event.status().isProblem()) return;

        TestUnit unit = event.unit();
        String label = String.format(Locale.ROOT, "%-5s", event.status().label());
        out.println("  " + ansi.string("@|" + StatusStyle.of(event.status()) + " " + label + "|@") + " "
                + unit.displayName() + " (" + Durations.format(event.duration()) + ")");

        if (verbose) {
            out.println("        " + metadata(unit));
        }
        if (event.message() != null && !event.message().isEmpty()) {
            out.println("        " + event.message());
        }
        ErrorDetail error = event.error();
        if (verbose && error != null) {
            if (error.location() != null) {
                out.println("        at " + error.location());
            }
            for (String line : error.trace().split("\\R")) {
                if (!line.isBlank()) {
                    out.println("        " + line.strip());
                }
            }
        }
    }

    @Override
    public void runFinished(RunFinished event) {
        RunSummary summary = event.summary();
        if (quiet) {
            out.println(summaryLine(summary));
            out.flush();
            return;
        }

        out.println(RULE);
        out.println(ansi.string("@|bold Test Summary|@"));
        out.println("  " + summaryLine(summary));
        out.println(String.format(Locale.ROOT, "  Success rate: %.1f%%", summary.successRate()));
        out.println("  Total time: " + Durations.format(summary.elapsed()));
        TimingProfile timings = summary.timings();
        if (verbose && !timings.isEmpty()) {
            out.println("  Fastest: " + timings.fastestUnit() + " (" + Durations.format(timings.fastest()) + ")");
            out.println("  Slowest: " + timings.slowestUnit() + " (" + Durations.format(timings.slowest()) + ")");
            out.println("  Average: " + Durations.format(timings.average()));
        }
        if (summary.interrupted()) {
            out.println(ansi.string("@|bold,fg(yellow) Run interrupted|@") + " before all tests ran");
        }
        out.flush();
    }

    private String summaryLine(RunSummary summary) {
        return "Tests run: " + summary.testsRun()
                + ", " + ansi.string("@|fg(green) Passed: " + summary.passed() + "|@")
                + ", " + colored(summary.failed() > 0, "Failures: " + summary.failed())
                + ", " + colored(summary.errored() > 0, "Errors: " + summary.errored())
                + ", Skipped: " + summary.skipped();
    }

    private String colored(boolean problem, String text) {
        return problem ? ansi.string("@|fg(red) " + text + "|@") : text;
    }

    private static String metadata(TestUnit unit) {
        StringBuilder text = new StringBuilder("[").append(unit.category().id());
        unit.scopeLabel().ifPresent(scope -> text.append(", scope=").append(scope));
        unit.phaseLabel().ifPresent(phase -> text.append(", phase=").append(phase));
        if (unit.slow()) text.append(", slow");
        if (unit.skipCi()) text.append(", skip-ci");
        return text.append("] ").append(unit.source()).toString();
    }
}
