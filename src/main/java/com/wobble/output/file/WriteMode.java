package com.wobble.output.file;

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;

/**
 * How the target file is opened.
 */
public enum WriteMode {
    /** Keep existing content and add after it. */
    APPEND(StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND),
    /** Truncate an existing file or create a new one. */
    OVERWRITE(StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);

    private final OpenOption[] openOptions;

    WriteMode(OpenOption... openOptions) {
        this.openOptions = openOptions;
    }

    public OpenOption[] openOptions() {
        return openOptions.clone();
    }
}
