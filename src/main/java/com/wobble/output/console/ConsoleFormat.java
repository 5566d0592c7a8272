package com.wobble.output.console;

import java.util.Locale;

/**
 * Console rendering strategies.
 */
public enum ConsoleFormat {
    STANDARD,
    VERBOSE,
    JSON,
    MINIMAL;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConsoleFormat fromId(String id) {
        for (ConsoleFormat format : values()) {
            if (format.id().equalsIgnoreCase(id)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + id
                + " (expected standard, verbose, json or minimal)");
    }
}
