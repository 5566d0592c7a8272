package com.wobble.core.framework;

import java.nio.file.Path;

/**
 * A candidate test source located by a {@link TestFramework}.
 *
 * @param file         absolute path of the source file
 * @param relativePath path relative to the classes root, {@code /}-separated; the lexical sort key
 */
public record TestSource(Path file, String relativePath) implements Comparable<TestSource> {

    /** Directory part of {@link #relativePath}, empty for sources at the root. */
    public String relativeDirectory() {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    @Override
    public int compareTo(TestSource other) {
        return relativePath.compareTo(other.relativePath);
    }
}
