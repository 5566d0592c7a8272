package com.wobble.core.framework;

import com.wobble.core.model.TestHandle;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The sequential test-execution framework wobble drives.
 * <p>
 * Implementations locate test sources, load the tests they declare and execute one test at a time.
 * Executing a test must not throw for test-level problems; those are reported through
 * {@link NativeOutcome}.
 */
public interface TestFramework extends AutoCloseable {

    /**
     * Finds candidate sources under {@code searchRoot} whose file name matches the glob {@code pattern},
     * sorted by their path relative to the classes root.
     *
     * @throws IOException if the directory walk fails
     */
    List<TestSource> locate(Path searchRoot, String pattern) throws IOException;

    /**
     * Loads the tests declared by one source, in declaration order.
     *
     * @throws TestLoadException if the source cannot be loaded
     */
    List<LoadedTest> load(TestSource source) throws TestLoadException;

    /**
     * Runs one test and blocks until it completes.
     */
    NativeOutcome execute(TestHandle handle);

    @Override
    default void close() {
    }
}
