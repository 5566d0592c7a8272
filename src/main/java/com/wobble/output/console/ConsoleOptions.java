package com.wobble.output.console;

import picocli.CommandLine.Help.Ansi;

import java.util.Objects;

/**
 * Console rendering choices for one run.
 *
 * @param format    rendering strategy
 * @param verbosity number of {@code -v} flags
 * @param quiet     show only problems and the final summary line
 * @param ansi      {@link Ansi#ON} or {@link Ansi#OFF}, as decided by {@link ColorPolicy}
 */
public record ConsoleOptions(ConsoleFormat format, int verbosity, boolean quiet, Ansi ansi) {

    public ConsoleOptions {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(ansi, "ansi");
        if (verbosity < 0) {
            throw new IllegalArgumentException("verbosity must not be negative");
        }
    }

    /** Report level of the json format: no {@code -v} gives 1, one gives 2, more give 3. */
    public int jsonLevel() {
        return Math.min(verbosity + 1, 3);
    }
}
