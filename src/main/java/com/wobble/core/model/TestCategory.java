package com.wobble.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse classification of a test unit's purpose.
 */
public enum TestCategory {
    REGRESSION("regression"),
    INTEGRATION("integration"),
    DEVELOPMENT("development"),
    UNCATEGORIZED("uncategorized");

    private final String id;

    TestCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Maps a directory name to the category it stands for in a hierarchical test layout.
     * Matching is case-insensitive and on the whole name, so {@code devices} is not {@code dev}.
     */
    public static Optional<TestCategory> fromDirectoryName(String directoryName) {
        if (directoryName == null) return Optional.empty();
        return switch (directoryName.toLowerCase(Locale.ROOT)) {
            case "regression" -> Optional.of(REGRESSION);
            case "integration" -> Optional.of(INTEGRATION);
            case "development", "dev" -> Optional.of(DEVELOPMENT);
            default -> Optional.empty();
        };
    }

    public static TestCategory fromId(String id) {
        for (TestCategory category : values()) {
            if (category.id.equalsIgnoreCase(id)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown test category: " + id);
    }
}
