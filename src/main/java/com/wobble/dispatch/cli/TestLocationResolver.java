package com.wobble.dispatch.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finds the repository root and the compiled test classes when they are not given explicitly.
 */
public final class TestLocationResolver {

    /** Files or directories that mark a repository root. */
    static final List<String> ROOT_MARKERS = List.of(
            ".git", "pom.xml", "build.gradle", "build.gradle.kts", "settings.gradle"
    );

    /** Where build tools put compiled test classes, relative to a project directory. */
    static final List<Path> CLASSES_DIRS = List.of(
            Path.of("target", "test-classes"),
            Path.of("build", "classes", "java", "test"),
            Path.of("out", "test")
    );

    private TestLocationResolver() {}

    /**
     * Walks up from {@code start} to the nearest directory holding a root marker.
     */
    public static Optional<Path> detectRepositoryRoot(Path start) {
        Path current = start.toAbsolutePath().normalize();
        while (current != null) {
            for (String marker : ROOT_MARKERS) {
                if (Files.exists(current.resolve(marker))) {
                    return Optional.of(current);
                }
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * The classes root for a path: the enclosing compiled-test directory if {@code path} lies inside
     * one, else the first compiled-test directory under it, else {@code path} itself.
     */
    public static Path detectClassesRoot(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        for (Path current = normalized; current != null; current = current.getParent()) {
            for (Path classesDir : CLASSES_DIRS) {
                if (current.endsWith(classesDir)) {
                    return current;
                }
            }
        }
        for (Path classesDir : CLASSES_DIRS) {
            Path candidate = normalized.resolve(classesDir);
            if (Files.isDirectory(candidate)) {
                return candidate;
            }
        }
        return normalized;
    }
}
