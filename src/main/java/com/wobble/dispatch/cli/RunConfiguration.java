package com.wobble.dispatch.cli;

import com.wobble.core.discovery.DiscoveryFilter;
import com.wobble.output.console.ConsoleOptions;
import com.wobble.output.file.FileOutput;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything one invocation needs, resolved from the command line and the configuration.
 *
 * @param mode           run, discover only or list categories
 * @param searchRoot     directory walked for test classes
 * @param classesRoot    classpath root of the compiled tests
 * @param extraClasspath additional classpath entries
 * @param pattern        test file glob
 * @param filter         category, slow and ci selection
 * @param console        console rendering
 * @param fileOutput     file output, {@code null} when not requested
 * @param command        the command line, for reports
 */
public record RunConfiguration(
    RunMode mode,
    Path searchRoot,
    Path classesRoot,
    List<Path> extraClasspath,
    String pattern,
    DiscoveryFilter filter,
    ConsoleOptions console,
    FileOutput fileOutput,
    String command
) {

    public RunConfiguration {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(searchRoot, "searchRoot");
        Objects.requireNonNull(classesRoot, "classesRoot");
        Objects.requireNonNull(console, "console");
        extraClasspath = extraClasspath == null ? List.of() : List.copyOf(extraClasspath);
        filter = filter == null ? DiscoveryFilter.all() : filter;
    }

    public Optional<FileOutput> file() {
        return Optional.ofNullable(fileOutput);
    }
}
