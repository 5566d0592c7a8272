package com.wobble.fixtures;

import com.wobble.core.framework.ReflectiveTestFramework;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Copies the {@code linkage} fixtures into a fresh classes root without {@code MissingType}, so that
 * {@code ChildCheck} loads but its superclass cannot be linked.
 */
public final class BrokenLinkageTree {

    public static final String PACKAGE_DIR = "com/wobble/fixtures/linkage";

    private static final String PACKAGE = "com.wobble.fixtures.linkage.";
    private static final List<String> COPIED = List.of("BaseWithMissingType", "ChildCheck", "SoundCheck");

    private BrokenLinkageTree() {}

    /** Writes the tree under {@code root} and returns the search directory. */
    public static Path create(Path root) throws IOException {
        Path source = FixtureTrees.tree("linkage");
        Path target = root.resolve(PACKAGE_DIR);
        Files.createDirectories(target);
        for (String name : COPIED) {
            Files.copy(source.resolve(name + ".class"), target.resolve(name + ".class"));
        }
        return target;
    }

    /**
     * A framework over {@code root} whose parent loader cannot see the linkage fixtures, so every one of
     * them is defined from the copied tree.
     */
    public static ReflectiveTestFramework framework(Path root) {
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        thread.setContextClassLoader(new HidingClassLoader(previous));
        try {
            return new ReflectiveTestFramework(root, List.of());
        } finally {
            thread.setContextClassLoader(previous);
        }
    }

    private static final class HidingClassLoader extends ClassLoader {

        HidingClassLoader(ClassLoader parent) {
            super(parent);
        }

        @Override
        protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
            if (name.startsWith(PACKAGE)) {
                throw new ClassNotFoundException(name);
            }
            return super.loadClass(name, resolve);
        }
    }
}
