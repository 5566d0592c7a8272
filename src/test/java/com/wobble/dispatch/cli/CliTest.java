package com.wobble.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wobble.config.WobbleProperties;
import com.wobble.core.framework.ReflectiveTestFramework;
import com.wobble.fixtures.FixtureTrees;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the wobble command line.
 * These tests exercise picocli directly without a Spring context, against the compiled fixture
 * trees and the reflective test framework.
 */
class CliTest {

    @TempDir
    Path workDir;

    private record CliResult(int exitCode, String output, String errors) {}

    private CliResult execute(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8);
        PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8);

        WobbleProperties properties = new WobbleProperties();
        TestRunService service = new TestRunService(ReflectiveTestFramework::new, properties, new ObjectMapper());
        WobbleCommand command = new WobbleCommand(service, properties)
                .withStreams(outStream, errStream)
                .withWorkingDirectory(workDir);

        CommandLine cmd = WobbleCommand.commandLine(command, null);
        cmd.setOut(new PrintWriter(outStream, true));
        cmd.setErr(new PrintWriter(errStream, true));
        int exitCode = cmd.execute(args);
        return new CliResult(exitCode, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
    }

    /** Fixture arguments for a tree plus any extra arguments. */
    private CliResult executeOn(String tree, String... extra) {
        List<String> args = new ArrayList<>(List.of(
                "--classes-root", FixtureTrees.classesRoot().toString(),
                "--path", FixtureTrees.tree(tree).toString(),
                "-p", FixtureTrees.PATTERN,
                "--no-color"));
        args.addAll(List.of(extra));
        return execute(args.toArray(String[]::new));
    }

    // -- Command structure --------------------------------------------------

    @Nested
    @DisplayName("command structure")
    class StructureTests {

        @Test
        void helpListsTheMainOptions() {
            CliResult result = execute("--help");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("--category"));
            assertTrue(result.output().contains("--discover-only"));
            assertTrue(result.output().contains("--log-file"));
        }

        @Test
        void version() {
            CliResult result = execute("--version");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("wobble 0.1.0"));
        }

        @Test
        void unknownOptionIsAUsageError() {
            assertEquals(ExitCodes.CONFIGURATION, execute("--frobnicate").exitCode());
        }
    }

    // -- Running ------------------------------------------------------------

    @Nested
    @DisplayName("running tests")
    class RunTests {

        @Test
        @DisplayName("a passing tree exits 0 with a summary")
        void passingRun() {
            CliResult result = executeOn("tree/flat");

            assertEquals(ExitCodes.OK, result.exitCode(), result.errors());
            assertTrue(result.output().contains("[WOBBLE] Running 6 tests"));
            assertTrue(result.output().contains("Tests run: 6, Passed: 6, Failures: 0, Errors: 0, Skipped: 0"));
        }

        @Test
        @DisplayName("failures and errors exit 1")
        void failingRun() {
            CliResult result = executeOn("outcomes");

            assertEquals(ExitCodes.TEST_FAILURES, result.exitCode());
            assertTrue(result.output().contains("OutcomeCheck.assertionFails"));
            assertTrue(result.output().contains("sum is off"));
        }

        @Test
        @DisplayName("category selection runs only that category")
        void categorySelection() {
            CliResult result = executeOn("tree/flat", "-c", "regression");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("Tests run: 3,"));
            assertFalse(result.output().contains("GatewayCheck"));
        }

        @Test
        @DisplayName("dev is accepted for the development category")
        void devAlias() {
            CliResult result = executeOn("hierarchy", "-c", "dev");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("ConflictCheck.taggedDifferentlyFromItsDirectory"));
            assertTrue(result.output().contains("Tests run: 1,"));
        }

        @Test
        @DisplayName("slow and ci-skipped tests can be excluded")
        void exclusions() {
            CliResult result = executeOn("hierarchy/integration", "--exclude-slow", "--exclude-ci");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("NightlyCheck.quickSmoke"));
            assertFalse(result.output().contains("fullReindex"));
            assertFalse(result.output().contains("needsLocalDatabase"));
        }

        @Test
        @DisplayName("an empty selection warns and exits 0")
        void emptySelection() {
            CliResult result = executeOn("tree/flat", "-c", "development");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.errors().contains("No tests found"));
            assertFalse(result.output().contains("Running"));
        }

        @Test
        @DisplayName("json console output is a single parseable document")
        void jsonConsole() throws Exception {
            CliResult result = executeOn("tree/flat", "-f", "json", "-v");

            assertEquals(ExitCodes.OK, result.exitCode());
            JsonNode root = new ObjectMapper().readTree(result.output());
            assertEquals(6, root.get("tests_run").asInt());
            assertEquals(6, root.get("results").size());
            assertTrue(root.at("/run_info/command").asText().startsWith("wobble --classes-root"));
        }

        @Test
        @DisplayName("minimal output prints one symbol per test")
        void minimalConsole() {
            CliResult result = executeOn("outcomes", "-f", "minimal");

            String symbols = result.output().lines()
                    .filter(line -> line.matches("[.FEs]+"))
                    .findFirst().orElseThrow();
            assertEquals(7, symbols.length());
        }
    }

    // -- File output --------------------------------------------------------

    @Nested
    @DisplayName("file output")
    class FileOutputTests {

        @Test
        @DisplayName("json file output takes its format from the extension")
        void jsonFile() throws Exception {
            CliResult result = executeOn("tree/flat", "--log-file", "out/results.json", "--log-verbosity", "3");

            assertEquals(ExitCodes.OK, result.exitCode(), result.errors());
            Path file = workDir.resolve("out/results.json");
            JsonNode root = new ObjectMapper().readTree(file.toFile());
            assertEquals(6, root.get("tests_run").asInt());
            assertEquals(6, root.get("results").size());
            assertTrue(result.output().contains("Results written to " + file));
        }

        @Test
        @DisplayName("without a name a timestamped text file is created")
        void autoNamedFile() throws Exception {
            CliResult result = executeOn("tree/flat", "--log-file");

            assertEquals(ExitCodes.OK, result.exitCode(), result.errors());
            try (Stream<Path> files = Files.list(workDir)) {
                List<Path> written = files.toList();
                assertEquals(1, written.size());
                assertTrue(written.get(0).getFileName().toString().matches("wobble_results_\\d{8}_\\d{6}\\.txt"));
                assertTrue(Files.readString(written.get(0)).contains("SUMMARY"));
            }
        }

        @Test
        @DisplayName("append keeps earlier runs")
        void append() throws Exception {
            executeOn("tree/flat", "--log-file", "runs.txt");
            executeOn("tree/flat", "--log-file", "runs.txt", "--log-append");

            String content = Files.readString(workDir.resolve("runs.txt"));
            assertEquals(2, content.lines().filter(line -> line.startsWith("SUMMARY")).count());
        }

        @Test
        @DisplayName("a directory as log file is a configuration error")
        void directoryTarget() throws Exception {
            Files.createDirectory(workDir.resolve("logs"));

            CliResult result = executeOn("tree/flat", "--log-file", "logs");

            assertEquals(ExitCodes.CONFIGURATION, result.exitCode());
        }
    }

    // -- Discovery modes ------------------------------------------------------

    @Nested
    @DisplayName("discovery modes")
    class DiscoveryTests {

        @Test
        void discoverOnly() {
            CliResult result = executeOn("tree/flat", "--discover-only");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("Total tests discovered: 6"));
            assertTrue(result.output().contains("Regression: 3"));
            assertFalse(result.output().contains("Tests run:"));
        }

        @Test
        void discoverOnlyWritesJsonReport() throws Exception {
            CliResult result = executeOn("hierarchy", "--discover-only", "--log-file", "discovery.json",
                    "--log-verbosity", "3");

            assertEquals(ExitCodes.OK, result.exitCode());
            JsonNode summary = new ObjectMapper().readTree(workDir.resolve("discovery.json").toFile())
                    .get("discovery_summary");
            assertEquals(6, summary.get("total_tests").asInt());
            assertEquals(3, summary.at("/categories/integration").asInt());
            assertEquals(1, summary.at("/categories/development").asInt());
            assertEquals(2, summary.at("/tests_by_category/regression").size());
        }

        @Test
        void listCategories() {
            CliResult result = executeOn("tree/flat", "--list-categories");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("Test categories:"));
            assertTrue(result.output().contains("  regression: 3"));
            assertTrue(result.output().contains("  integration: 2"));
            assertTrue(result.output().contains("  development: 0"));
            assertTrue(result.output().contains("  uncategorized: 1"));
        }
    }

    // -- Configuration errors ---------------------------------------------------

    @Nested
    @DisplayName("configuration errors exit 2")
    class ConfigurationTests {

        @Test
        void unknownCategory() {
            CliResult result = executeOn("tree/flat", "-c", "smoke");

            assertEquals(ExitCodes.CONFIGURATION, result.exitCode());
            assertTrue(result.errors().contains("Unknown category: smoke"));
        }

        @Test
        void quietWithVerbose() {
            assertEquals(ExitCodes.CONFIGURATION, executeOn("tree/flat", "-q", "-v").exitCode());
        }

        @Test
        void appendWithOverwrite() {
            assertEquals(ExitCodes.CONFIGURATION,
                    executeOn("tree/flat", "--log-file", "x.txt", "--log-append", "--log-overwrite").exitCode());
        }

        @Test
        void missingPath() {
            CliResult result = execute("--path", workDir.resolve("nowhere").toString());

            assertEquals(ExitCodes.CONFIGURATION, result.exitCode());
            assertTrue(result.errors().contains("--path"));
        }

        @Test
        void logVerbosityOutOfRange() {
            assertEquals(ExitCodes.CONFIGURATION, executeOn("tree/flat", "--log-verbosity", "5").exitCode());
        }

        @Test
        void unknownFormat() {
            assertEquals(ExitCodes.CONFIGURATION, executeOn("tree/flat", "-f", "fancy").exitCode());
        }

        @Test
        void unknownFileFormat() {
            assertEquals(ExitCodes.CONFIGURATION,
                    executeOn("tree/flat", "--log-file", "x.out", "--log-file-format", "xml").exitCode());
        }
    }
}
