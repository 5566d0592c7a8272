package com.wobble.output.console;

import com.wobble.core.events.RunFinished;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.events.TestStarted;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestStatus;
import com.wobble.output.report.Durations;
import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;

/**
 * One character per finished unit, then one summary line.
 */
class MinimalRenderer implements ConsoleRenderer {

    private final PrintStream out;
    private final Ansi ansi;

    MinimalRenderer(PrintStream out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    @Override
    public void runStarted(RunStarted event) {
    }

    @Override
    public void testStarted(TestStarted event) {
    }

    @Override
    public void testFinished(TestFinished event) {
        TestStatus status = event.status();
        out.print(ansi.string("@|" + StatusStyle.of(status) + " " + status.symbol() + "|@"));
        out.flush();
    }

    @Override
    public void runFinished(RunFinished event) {
        RunSummary summary = event.summary();
        out.println();
        String line = summary.testsRun() + " run, " + summary.passed() + " passed, " + summary.failed()
                + " failed, " + summary.errored() + " errors, " + summary.skipped() + " skipped in "
                + Durations.format(summary.elapsed()) + (summary.interrupted() ? " (interrupted)" : "");
        String color = summary.hasProblems() || summary.interrupted() ? "fg(red)" : "fg(green)";
        out.println(ansi.string("@|" + color + " " + line + "|@"));
        out.flush();
    }
}
