package com.wobble.output.file;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes job payloads to the open file. Used only by the writer thread.
 */
public interface RecordLayout {

    void write(WriteJob job, Writer out) throws IOException;

    /**
     * Called once after the last job when the stream ended normally.
     */
    default void finish(Writer out) throws IOException {
    }
}
