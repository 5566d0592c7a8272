package com.wobble.output.file;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One requested file output.
 *
 * @param target    file to write
 * @param format    txt or json
 * @param verbosity detail level from 1 to 3, independent of the console verbosity
 * @param mode      append or overwrite
 */
public record FileOutput(Path target, FileFormat format, int verbosity, WriteMode mode) {

    public FileOutput {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(mode, "mode");
        if (verbosity < 1 || verbosity > 3) {
            throw new IllegalArgumentException("File verbosity must be between 1 and 3 but was " + verbosity);
        }
    }
}
