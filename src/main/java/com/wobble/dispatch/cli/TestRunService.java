package com.wobble.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.config.WobbleProperties;
import com.wobble.core.discovery.DiscoveryEngine;
import com.wobble.core.discovery.DiscoveryRequest;
import com.wobble.core.discovery.TestUnitRegistry;
import com.wobble.core.engine.CancellationToken;
import com.wobble.core.engine.ExecutionEngine;
import com.wobble.core.events.EventBroadcastHub;
import com.wobble.core.framework.TestFramework;
import com.wobble.core.framework.TestFrameworkFactory;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestUnit;
import com.wobble.output.console.ConsoleSink;
import com.wobble.output.file.FileFormat;
import com.wobble.output.file.FileOutput;
import com.wobble.output.file.FileSink;
import com.wobble.output.file.ShutdownReport;
import com.wobble.output.report.DiscoveryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one resolved {@link RunConfiguration}: discovery, then either a discovery report or the
 * execution pipeline with its console and file sinks.
 */
@Service
public class TestRunService {

    private static final Logger log = LoggerFactory.getLogger(TestRunService.class);

    private final TestFrameworkFactory frameworkFactory;
    private final WobbleProperties properties;
    private final ObjectMapper objectMapper;

    public TestRunService(TestFrameworkFactory frameworkFactory, WobbleProperties properties,
                          ObjectMapper objectMapper) {
        this.frameworkFactory = frameworkFactory;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @return the process exit code
     */
    public int execute(RunConfiguration config, ConsoleOutput console) {
        try (TestFramework framework = frameworkFactory.create(config.classesRoot(), config.extraClasspath())) {
            console.info("Discovering tests in: " + config.searchRoot());
            TestUnitRegistry registry = new DiscoveryEngine(framework).discover(
                    new DiscoveryRequest(List.of(config.searchRoot()), config.pattern(), config.filter()));

            return switch (config.mode()) {
                case LIST_CATEGORIES -> listCategories(registry, console);
                case DISCOVER_ONLY -> discoverOnly(registry, config, console);
                case RUN -> run(registry, framework, config, console);
            };
        } catch (IOException e) {
            log.error("Discovery failed under {}", config.searchRoot(), e);
            console.error("Discovery failed: " + e.getMessage());
            return ExitCodes.INTERNAL;
        }
    }

    private int listCategories(TestUnitRegistry registry, ConsoleOutput console) {
        console.line("Test categories:");
        for (Map.Entry<TestCategory, Integer> entry : registry.countsByCategory().entrySet()) {
            console.line("  " + entry.getKey().id() + ": " + entry.getValue());
        }
        return ExitCodes.OK;
    }

    private int discoverOnly(TestUnitRegistry registry, RunConfiguration config, ConsoleOutput console) {
        DiscoveryReport report = new DiscoveryReport(objectMapper);
        Instant now = Instant.now();
        console.line(report.text(registry, 1, now).stripTrailing());

        FileOutput output = config.fileOutput();
        if (output == null) {
            return ExitCodes.OK;
        }
        String content = output.format() == FileFormat.JSON
                ? report.json(registry, output.verbosity(), now)
                : report.text(registry, output.verbosity(), now);
        try {
            Path parent = output.target().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output.target(), content + System.lineSeparator(), output.mode().openOptions());
            console.success("Discovery report written to " + output.target());
        } catch (IOException e) {
            log.error("Failed to write discovery report to {}", output.target(), e);
            console.error("Failed to write discovery report to " + output.target() + ": " + e.getMessage());
        }
        return ExitCodes.OK;
    }

    private int run(TestUnitRegistry registry, TestFramework framework, RunConfiguration config,
                    ConsoleOutput console) {
        List<TestUnit> selected = registry.select(config.filter());
        if (selected.isEmpty()) {
            console.warning("No tests found matching the requested selection");
            return ExitCodes.OK;
        }

        EventBroadcastHub hub = new EventBroadcastHub();
        hub.register(ConsoleSink.create(config.console(), console.out(), objectMapper));
        FileSink fileSink = null;
        if (config.fileOutput() != null) {
            fileSink = FileSink.open(config.fileOutput(), objectMapper, properties.getQueueCapacity(),
                    properties.getEnqueueWait(), properties.getShutdownTimeout(),
                    message -> console.warning("File output: " + message));
            hub.register(fileSink);
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        CancellationToken token = new CancellationToken();
        RunSummary summary;
        try (RunInterruptHandler interrupts = RunInterruptHandler.install(token, properties.getInterruptWait(),
                console::warning)) {
            try {
                summary = new ExecutionEngine(framework, hub).run(runId, config.command(), selected, token);
            } finally {
                hub.closeAll();
            }
        }

        if (fileSink != null) {
            ShutdownReport report = fileSink.report();
            if (report != null && report.clean()) {
                console.success("Results written to " + report.target());
            } else if (report != null) {
                log.warn("File output incomplete: {}", report);
            }
        }
        console.flush();

        if (summary.interrupted()) return ExitCodes.INTERRUPTED;
        return summary.hasProblems() ? ExitCodes.TEST_FAILURES : ExitCodes.OK;
    }
}
