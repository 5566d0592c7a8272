package com.wobble.output.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wobble.core.events.RunStarted;
import com.wobble.core.events.TestFinished;
import com.wobble.core.model.ErrorDetail;
import com.wobble.core.model.RunSummary;
import com.wobble.core.model.TestUnit;
import com.wobble.core.model.TimingProfile;

import java.util.List;
import java.util.Locale;

/**
 * Builds the structured run report shared by the json console format and json file output.
 * <p>
 * Level 1 holds counts only, level 2 adds per-unit results with timing and metadata, level 3 adds the
 * error type, message, trace and file location of each failed or errored unit.
 */
public class JsonReport {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 3;

    private final ObjectMapper objectMapper;
    private final int level;

    public JsonReport(ObjectMapper objectMapper, int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Report level must be between 1 and 3 but was " + level);
        }
        this.objectMapper = objectMapper;
        this.level = level;
    }

    public int level() {
        return level;
    }

    public boolean includesResults() {
        return level >= 2;
    }

    public ObjectNode runInfo(RunStarted started) {
        ObjectNode info = objectMapper.createObjectNode();
        info.put("run_id", started.runId());
        info.put("command", started.command());
        info.put("started_at", started.timestamp().toString());
        info.put("planned_tests", started.plannedUnits());
        return info;
    }

    public ObjectNode result(TestFinished finished) {
        TestUnit unit = finished.unit();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", unit.displayName());
        node.put("id", unit.id());
        node.put("class", unit.className());
        node.put("status", finished.status().label());
        node.put("duration", Durations.roundedSeconds(finished.duration()));
        node.put("category", unit.category().id());

        ObjectNode metadata = node.putObject("metadata");
        metadata.put("category_source", unit.categorySource().name().toLowerCase(Locale.ROOT));
        unit.scopeLabel().ifPresent(scope -> metadata.put("scope", scope));
        unit.phaseLabel().ifPresent(phase -> metadata.put("phase", phase));
        metadata.put("slow", unit.slow());
        metadata.put("skip_ci", unit.skipCi());
        metadata.put("source", unit.source());

        if (finished.message() != null) {
            node.put("message", finished.message());
        }
        ErrorDetail error = finished.error();
        if (level >= 3 && error != null) {
            ObjectNode errorInfo = node.putObject("error_info");
            errorInfo.put("type", error.type());
            errorInfo.put("message", error.message());
            errorInfo.put("traceback", error.trace());
            if (error.location() != null) {
                errorInfo.put("location", error.location());
            }
        }
        return node;
    }

    /**
     * Assembles the final document.
     *
     * @param runInfo run information, may be {@code null} when the start of the run was not seen
     * @param results per-unit results in completion order; ignored below level 2
     * @param summary the run summary
     */
    public ObjectNode document(ObjectNode runInfo, List<ObjectNode> results, RunSummary summary) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("timestamp", summary.finishedAt().toString());
        root.put("tests_run", summary.testsRun());
        root.put("passed", summary.passed());
        root.put("failures", summary.failed());
        root.put("errors", summary.errored());
        root.put("skipped", summary.skipped());
        root.put("success_rate", Math.round(summary.successRate() * 100.0) / 100.0);
        root.put("total_time", Durations.roundedSeconds(summary.elapsed()));
        root.put("interrupted", summary.interrupted());
        if (runInfo != null) {
            root.set("run_info", runInfo);
        }

        if (includesResults()) {
            TimingProfile timings = summary.timings();
            if (!timings.isEmpty()) {
                ObjectNode performance = root.putObject("performance");
                performance.put("fastest_test", timings.fastestUnit());
                performance.put("fastest_time", Durations.roundedSeconds(timings.fastest()));
                performance.put("slowest_test", timings.slowestUnit());
                performance.put("slowest_time", Durations.roundedSeconds(timings.slowest()));
                performance.put("average_time", Durations.roundedSeconds(timings.average()));
            }
            ArrayNode array = root.putArray("results");
            results.forEach(array::add);
        }
        return root;
    }

    public String toJson(ObjectNode node) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
