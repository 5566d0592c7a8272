package com.wobble.dispatch.cli;

import picocli.CommandLine.Help.Ansi;

import java.io.PrintStream;

/**
 * Colored notices printed around a run. Informational lines go to standard output, warnings and
 * errors to standard error so that a json report on standard output stays parseable.
 */
public class ConsoleOutput {

    private final PrintStream out;
    private final PrintStream err;
    private final Ansi ansi;
    private final boolean silent;

    /**
     * @param silent suppress informational lines (quiet mode and json output)
     */
    public ConsoleOutput(PrintStream out, PrintStream err, Ansi ansi, boolean silent) {
        this.out = out;
        this.err = err;
        this.ansi = ansi;
        this.silent = silent;
    }

    public PrintStream out() {
        return out;
    }

    public Ansi ansi() {
        return ansi;
    }

    public void info(String message) {
        if (silent) return;
        out.println(ansi.string("@|fg(cyan) [WOBBLE]|@ ") + message);
    }

    public void success(String message) {
        if (silent) return;
        out.println(ansi.string("@|fg(green) +|@ ") + message);
    }

    public void warning(String message) {
        err.println(ansi.string("@|fg(yellow) !|@ ") + message);
    }

    public void error(String message) {
        err.println(ansi.string("@|fg(red) x|@ ") + message);
    }

    /** Plain line on standard output, printed even when informational lines are suppressed. */
    public void line(String text) {
        out.println(text);
    }

    public void flush() {
        out.flush();
        err.flush();
    }
}
