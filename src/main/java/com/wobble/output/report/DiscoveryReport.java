package com.wobble.output.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wobble.core.discovery.TestUnitRegistry;
import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestUnit;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders what discovery found, without running anything, as text or as a {@code discovery_summary}
 * JSON document.
 * <p>
 * Level 1 lists the total and per-category counts. Level 2 adds the uncategorized units and the
 * sources that failed to load. Level 3 lists every unit under its category.
 */
public class DiscoveryReport {

    private final ObjectMapper objectMapper;

    public DiscoveryReport(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String text(TestUnitRegistry registry, int level, Instant timestamp) {
        StringBuilder out = new StringBuilder();
        out.append("Test Discovery Summary").append(System.lineSeparator());
        out.append("Generated: ").append(timestamp).append(System.lineSeparator());
        out.append("Total tests discovered: ").append(registry.size()).append(System.lineSeparator());
        for (Map.Entry<TestCategory, List<TestUnit>> entry : registry.byCategory().entrySet()) {
            out.append(label(entry.getKey())).append(": ").append(entry.getValue().size())
                    .append(System.lineSeparator());
        }

        if (level >= 2) {
            List<TestUnit> failures = registry.loadFailures();
            if (!failures.isEmpty()) {
                out.append(System.lineSeparator()).append("Load failures:").append(System.lineSeparator());
                for (TestUnit unit : failures) {
                    out.append("  ").append(unit.source()).append(" - ").append(unit.loadFailure().summary())
                            .append(System.lineSeparator());
                }
            }
        }

        if (level >= 3) {
            for (Map.Entry<TestCategory, List<TestUnit>> entry : registry.byCategory().entrySet()) {
                if (entry.getValue().isEmpty()) continue;
                out.append(System.lineSeparator()).append(label(entry.getKey())).append(" tests:")
                        .append(System.lineSeparator());
                for (TestUnit unit : entry.getValue()) {
                    out.append("  ").append(unit.id()).append(" (").append(unit.source()).append(')')
                            .append(flags(unit)).append(System.lineSeparator());
                }
            }
        } else if (level == 2) {
            List<TestUnit> uncategorized = registry.byCategory().get(TestCategory.UNCATEGORIZED);
            if (!uncategorized.isEmpty()) {
                out.append(System.lineSeparator()).append("Uncategorized tests:").append(System.lineSeparator());
                for (TestUnit unit : uncategorized) {
                    out.append("  ").append(unit.id()).append(System.lineSeparator());
                }
            }
        }
        return out.toString();
    }

    public String json(TestUnitRegistry registry, int level, Instant timestamp) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode summary = root.putObject("discovery_summary");
        summary.put("timestamp", timestamp.toString());
        summary.put("total_tests", registry.size());
        ObjectNode categories = summary.putObject("categories");
        registry.countsByCategory().forEach((category, count) -> categories.put(category.id(), count));

        if (level >= 2) {
            ArrayNode uncategorized = summary.putArray("uncategorized_tests");
            registry.byCategory().get(TestCategory.UNCATEGORIZED)
                    .forEach(unit -> uncategorized.add(describe(unit)));
            ArrayNode failures = summary.putArray("load_failures");
            for (TestUnit unit : registry.loadFailures()) {
                ObjectNode failure = describe(unit);
                failure.put("error", unit.loadFailure().summary());
                failures.add(failure);
            }
        }
        if (level >= 3) {
            ObjectNode byCategory = summary.putObject("tests_by_category");
            registry.byCategory().forEach((category, units) -> {
                ArrayNode list = byCategory.putArray(category.id());
                units.forEach(unit -> list.add(describe(unit)));
            });
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize discovery report", e);
        }
    }

    private ObjectNode describe(TestUnit unit) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", unit.methodName() != null ? unit.methodName() : unit.simpleClassName());
        node.put("class", unit.simpleClassName());
        int dot = unit.className().lastIndexOf('.');
        node.put("module", dot < 0 ? "" : unit.className().substring(0, dot));
        node.put("file", unit.source());
        node.put("id", unit.id());
        node.put("category_source", unit.categorySource().name().toLowerCase(Locale.ROOT));
        unit.scopeLabel().ifPresent(scope -> node.put("scope", scope));
        unit.phaseLabel().ifPresent(phase -> node.put("phase", phase));
        node.put("slow", unit.slow());
        node.put("skip_ci", unit.skipCi());
        return node;
    }

    /** {@code Regression}, {@code Uncategorized}, ... */
    public static String label(TestCategory category) {
        String id = category.id();
        return Character.toUpperCase(id.charAt(0)) + id.substring(1);
    }

    private static String flags(TestUnit unit) {
        StringBuilder flags = new StringBuilder();
        unit.scopeLabel().ifPresent(scope -> flags.append(" scope=").append(scope));
        unit.phaseLabel().ifPresent(phase -> flags.append(" phase=").append(phase));
        if (unit.slow()) flags.append(" [slow]");
        if (unit.skipCi()) flags.append(" [skip-ci]");
        if (unit.isLoadFailure()) flags.append(" [load failure]");
        return flags.toString();
    }
}
