package com.wobble.output.file;

import java.nio.file.Path;

/**
 * What the background writer managed to persist.
 *
 * @param target    the file written to
 * @param completed whether the worker finished within the shutdown timeout
 * @param written   jobs written to the file
 * @param discarded jobs dropped after an I/O fault or an elapsed shutdown timeout
 * @param fault     description of the first I/O fault, {@code null} if none occurred
 */
public record ShutdownReport(Path target, boolean completed, long written, long discarded, String fault) {

    /** True when every submitted job reached the file. */
    public boolean clean() {
        return completed && discarded == 0 && fault == null;
    }
}
