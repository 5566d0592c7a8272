package com.wobble.core.framework;

import java.nio.file.Path;
import java.util.List;

/**
 * Creates the framework for one run.
 */
@FunctionalInterface
public interface TestFrameworkFactory {

    /**
     * @param classesRoot    classpath root holding the compiled tests
     * @param extraClasspath additional entries needed to load them
     */
    TestFramework create(Path classesRoot, List<Path> extraClasspath);
}
