package com.wobble.core.tags;

import com.wobble.core.model.TestTags;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side table from test unit identity to its label set.
 * <p>
 * Populated once during discovery through a {@link Builder}; immutable afterwards.
 */
public final class TagRegistry {

    private final Map<String, TestTags> tagsByUnit;

    private TagRegistry(Map<String, TestTags> tagsByUnit) {
        this.tagsByUnit = Collections.unmodifiableMap(new LinkedHashMap<>(tagsByUnit));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Tags registered for the unit, or {@link TestTags#NONE}. */
    public TestTags tagsFor(String unitId) {
        return tagsByUnit.getOrDefault(unitId, TestTags.NONE);
    }

    public boolean isTagged(String unitId) {
        return !tagsFor(unitId).isEmpty();
    }

    /** True when at least one unit carries a tag. */
    public boolean hasAnyTags() {
        return tagsByUnit.values().stream().anyMatch(tags -> !tags.isEmpty());
    }

    public int size() {
        return tagsByUnit.size();
    }

    public Map<String, TestTags> asMap() {
        return tagsByUnit;
    }

    public static final class Builder {
        private final Map<String, TestTags> tags = new LinkedHashMap<>();

        private Builder() {}

        /** Registers the tags of a unit; the first registration of an id wins. */
        public Builder register(String unitId, TestTags unitTags) {
            tags.putIfAbsent(unitId, unitTags == null ? TestTags.NONE : unitTags);
            return this;
        }

        public TagRegistry build() {
            return new TagRegistry(tags);
        }
    }
}
