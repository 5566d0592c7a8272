package com.wobble.output.console;

import picocli.CommandLine.Help.Ansi;

import java.util.Map;

/**
 * Decides whether console output is colored.
 * <p>
 * Color is off when requested on the command line, when {@code NO_COLOR} or {@code WOBBLE_NO_COLOR}
 * is set to a non-empty value, or when standard output is not an interactive terminal.
 */
public final class ColorPolicy {

    public static final String NO_COLOR = "NO_COLOR";
    public static final String WOBBLE_NO_COLOR = "WOBBLE_NO_COLOR";

    private ColorPolicy() {}

    public static Ansi detect(boolean noColorRequested) {
        return resolve(noColorRequested, System.getenv(), System.console() != null);
    }

    public static Ansi resolve(boolean noColorRequested, Map<String, String> environment, boolean interactive) {
        if (noColorRequested) return Ansi.OFF;
        if (isSet(environment.get(NO_COLOR)) || isSet(environment.get(WOBBLE_NO_COLOR))) return Ansi.OFF;
        return interactive ? Ansi.ON : Ansi.OFF;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}
