package com.wobble.output.file;

import java.io.IOException;
import java.io.Writer;

/**
 * One entry per job, written as it arrives.
 */
class TextLayout implements RecordLayout {

    @Override
    public void write(WriteJob job, Writer out) throws IOException {
        out.write(job.payload());
        out.write(System.lineSeparator());
    }
}
