package com.wobble.dispatch.cli;

import com.wobble.config.WobbleProperties;
import com.wobble.core.discovery.DiscoveryFilter;
import com.wobble.core.model.TestCategory;
import com.wobble.output.console.ColorPolicy;
import com.wobble.output.console.ConsoleFormat;
import com.wobble.output.console.ConsoleOptions;
import com.wobble.output.file.FileFormat;
import com.wobble.output.file.FileOutput;
import com.wobble.output.file.WriteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Top-level CLI command for wobble: discovers categorized tests and runs them.
 */
@Command(
        name = "wobble",
        mixinStandardHelpOptions = true,
        version = "wobble 0.1.0",
        description = "Categorized test runner with console and file reporting",
        sortOptions = false
)
@Component
public class WobbleCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WobbleCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--category"}, split = ",",
            description = "Categories to run: regression, integration, development, all (default: all)")
    List<String> categories = new ArrayList<>();

    @Option(names = "--exclude-slow", description = "Skip tests tagged slow")
    boolean excludeSlow;

    @Option(names = "--exclude-ci", description = "Skip tests tagged to be skipped in CI")
    boolean excludeCi;

    @Option(names = {"-p", "--pattern"}, description = "File name pattern of test classes (default: wobble.discovery.pattern, *Test.class)")
    String pattern;

    @Option(names = "--path", description = "Repository root or directory to search (default: detected repository root)")
    Path path;

    @Option(names = "--classes-root", description = "Classpath root of the compiled tests (default: detected)")
    Path classesRoot;

    @Option(names = "--classpath", description = "Extra classpath entries needed to load the tests")
    String classpath;

    @Option(names = {"-f", "--format"}, defaultValue = "standard",
            description = "Console output: standard, verbose, json, minimal (default: ${DEFAULT-VALUE})")
    String format;

    @Option(names = "--no-color", description = "Disable colored output")
    boolean noColor;

    @Option(names = {"-v", "--verbose"}, description = "Increase console verbosity (repeatable)")
    boolean[] verbose = new boolean[0];

    @Option(names = {"-q", "--quiet"}, description = "Only show failures and the final summary")
    boolean quiet;

    @Option(names = "--discover-only", description = "Only discover tests, do not run them")
    boolean discoverOnly;

    @Option(names = "--list-categories", description = "List categories with their test counts")
    boolean listCategories;

    @Option(names = "--log-file", arity = "0..1", fallbackValue = "",
            description = "Write results to FILE (default name: wobble_results_<timestamp>.<ext>)")
    String logFile;

    @Option(names = "--log-file-format",
            description = "File output format: txt or json (default: from the file extension, else txt)")
    String logFileFormat;

    @Option(names = "--log-verbosity", defaultValue = "1",
            description = "File output detail, 1 to 3 (default: ${DEFAULT-VALUE})")
    int logVerbosity;

    @Option(names = "--log-append", description = "Append to an existing file")
    boolean logAppend;

    @Option(names = "--log-overwrite", description = "Overwrite an existing file (default)")
    boolean logOverwrite;

    private final TestRunService testRunService;
    private final WobbleProperties properties;
    private PrintStream out = System.out;
    private PrintStream err = System.err;
    private Path workingDirectory = Path.of("").toAbsolutePath();

    public WobbleCommand(TestRunService testRunService, WobbleProperties properties) {
        this.testRunService = testRunService;
        this.properties = properties;
    }

    /**
     * Builds the command line used to execute this command, mapping unexpected faults to
     * {@link ExitCodes#INTERNAL}. picocli already maps usage errors to {@link ExitCodes#CONFIGURATION}.
     */
    public static CommandLine commandLine(WobbleCommand command, CommandLine.IFactory factory) {
        CommandLine commandLine = factory == null ? new CommandLine(command) : new CommandLine(command, factory);
        commandLine.setExecutionExceptionHandler((ex, cl, parseResult) -> {
            log.error("Unexpected failure", ex);
            cl.getErr().println(cl.getColorScheme().errorText("Internal error: " + ex));
            return ExitCodes.INTERNAL;
        });
        return commandLine;
    }

    WobbleCommand withStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        return this;
    }

    WobbleCommand withWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory.toAbsolutePath().normalize();
        return this;
    }

    @Override
    public Integer call() {
        Ansi ansi = ColorPolicy.detect(noColor);
        RunConfiguration config;
        try {
            config = resolve(ansi);
        } catch (ConfigurationException e) {
            new ConsoleOutput(out, err, ansi, false).error(e.getMessage());
            return ExitCodes.CONFIGURATION;
        }
        ConsoleOutput console = new ConsoleOutput(out, err, ansi,
                config.console().quiet() || config.console().format() == ConsoleFormat.JSON);
        return testRunService.execute(config, console);
    }

    RunConfiguration resolve(Ansi ansi) {
        if (quiet && verbose.length > 0) {
            throw new ConfigurationException("--quiet and --verbose cannot be combined");
        }
        if (logAppend && logOverwrite) {
            throw new ConfigurationException("--log-append and --log-overwrite cannot be combined");
        }
        if (logVerbosity < 1 || logVerbosity > 3) {
            throw new ConfigurationException("--log-verbosity must be 1, 2 or 3 but was " + logVerbosity);
        }

        Path base = resolveBase();
        Path resolvedClassesRoot = classesRoot != null
                ? existingDirectory(classesRoot, "--classes-root")
                : TestLocationResolver.detectClassesRoot(base);
        Path searchRoot = base.startsWith(resolvedClassesRoot) ? base : resolvedClassesRoot;

        ConsoleOptions consoleOptions = new ConsoleOptions(parseFormat(), verbose.length, quiet, ansi);
        DiscoveryFilter filter = new DiscoveryFilter(parseCategories(), excludeSlow, excludeCi);
        RunMode mode = listCategories ? RunMode.LIST_CATEGORIES
                : discoverOnly ? RunMode.DISCOVER_ONLY
                : RunMode.RUN;

        List<Path> extraClasspath = new ArrayList<>();
        if (classpath != null) {
            for (String entry : classpath.split(File.pathSeparator)) {
                if (!entry.isBlank()) {
                    extraClasspath.add(workingDirectory.resolve(entry.trim()).normalize());
                }
            }
        }
        String resolvedPattern = pattern != null && !pattern.isBlank() ? pattern : properties.getPattern();

        return new RunConfiguration(mode, searchRoot, resolvedClassesRoot, extraClasspath, resolvedPattern,
                filter, consoleOptions, resolveFileOutput(), commandText());
    }

    private Path resolveBase() {
        if (path != null) {
            return existingDirectory(path, "--path");
        }
        return TestLocationResolver.detectRepositoryRoot(workingDirectory).orElse(workingDirectory);
    }

    private Path existingDirectory(Path candidate, String option) {
        Path resolved = workingDirectory.resolve(candidate).normalize();
        if (!Files.isDirectory(resolved)) {
            throw new ConfigurationException(option + " does not exist or is not a directory: " + candidate);
        }
        return resolved;
    }

    private ConsoleFormat parseFormat() {
        try {
            return ConsoleFormat.fromId(format);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }
    }

    private Set<TestCategory> parseCategories() {
        Set<TestCategory> requested = EnumSet.noneOf(TestCategory.class);
        for (String raw : categories) {
            String value = raw.trim();
            if (value.equalsIgnoreCase("all")) {
                return Set.of();
            }
            switch (value.toLowerCase(Locale.ROOT)) {
                case "regression" -> requested.add(TestCategory.REGRESSION);
                case "integration" -> requested.add(TestCategory.INTEGRATION);
                case "development", "dev" -> requested.add(TestCategory.DEVELOPMENT);
                default -> throw new ConfigurationException("Unknown category: " + value
                        + " (expected regression, integration, development or all)");
            }
        }
        return requested;
    }

    private FileOutput resolveFileOutput() {
        if (logFile == null) {
            if (logFileFormat != null || logAppend) {
                log.debug("File output options given without --log-file; ignoring them");
            }
            return null;
        }

        FileFormat fileFormat;
        try {
            fileFormat = logFileFormat != null
                    ? FileFormat.fromId(logFileFormat)
                    : (logFile.isEmpty() ? FileFormat.TXT : FileFormat.fromFileName(Path.of(logFile)).orElse(FileFormat.TXT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage());
        }

        Path target = logFile.isEmpty()
                ? LogFileNaming.autoName(workingDirectory, fileFormat, LocalDateTime.now())
                : workingDirectory.resolve(logFile).normalize();
        if (Files.isDirectory(target)) {
            throw new ConfigurationException("--log-file points to a directory: " + target);
        }
        return new FileOutput(target, fileFormat, logVerbosity, logAppend ? WriteMode.APPEND : WriteMode.OVERWRITE);
    }

    private String commandText() {
        List<String> args = spec != null && spec.commandLine().getParseResult() != null
                ? spec.commandLine().getParseResult().originalArgs()
                : List.of();
        return args.isEmpty() ? "wobble" : "wobble " + String.join(" ", args);
    }
}
