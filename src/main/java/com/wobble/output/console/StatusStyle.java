package com.wobble.output.console;

import com.wobble.core.model.TestStatus;

final class StatusStyle {

    private StatusStyle() {}

    /** picocli markup style for a status label. */
    static String of(TestStatus status) {
        return switch (status) {
            case PASSED -> "fg(green)";
            case FAILED -> "fg(red)";
            case ERRORED -> "bold,fg(red)";
            case SKIPPED -> "fg(yellow)";
        };
    }
}
