package com.wobble.dispatch.cli;

import com.wobble.output.file.FileFormat;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Names for file output requested without an explicit file name.
 */
public final class LogFileNaming {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private LogFileNaming() {}

    /** {@code wobble_results_<yyyyMMdd_HHmmss>.<ext>} inside {@code directory}. */
    public static Path autoName(Path directory, FileFormat format, LocalDateTime now) {
        return directory.resolve("wobble_results_" + STAMP.format(now) + "." + format.extension());
    }
}
