package com.wobble.core.discovery;

import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestUnit;
import com.wobble.core.tags.TagRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The units discovered for one run, in discovery order, with their category mapping.
 * Immutable once built.
 */
public final class TestUnitRegistry {

    private final List<TestUnit> units;
    private final Map<String, TestUnit> unitsById;
    private final Map<TestCategory, List<TestUnit>> byCategory;
    private final TagRegistry tags;

    private TestUnitRegistry(List<TestUnit> units, TagRegistry tags) {
        this.units = List.copyOf(units);
        this.tags = tags;

        Map<String, TestUnit> index = new LinkedHashMap<>();
        Map<TestCategory, List<TestUnit>> grouped = new EnumMap<>(TestCategory.class);
        for (TestCategory category : TestCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        for (TestUnit unit : this.units) {
            index.put(unit.id(), unit);
            grouped.get(unit.category()).add(unit);
        }
        grouped.replaceAll((category, list) -> List.copyOf(list));
        this.unitsById = Collections.unmodifiableMap(index);
        this.byCategory = Collections.unmodifiableMap(grouped);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TestUnit> units() {
        return units;
    }

    public int size() {
        return units.size();
    }

    public Optional<TestUnit> find(String unitId) {
        return Optional.ofNullable(unitsById.get(unitId));
    }

    /** Units per category; every category is present, possibly with an empty list. */
    public Map<TestCategory, List<TestUnit>> byCategory() {
        return byCategory;
    }

    public Map<TestCategory, Integer> countsByCategory() {
        Map<TestCategory, Integer> counts = new EnumMap<>(TestCategory.class);
        byCategory.forEach((category, list) -> counts.put(category, list.size()));
        return counts;
    }

    public List<TestUnit> loadFailures() {
        return units.stream().filter(TestUnit::isLoadFailure).toList();
    }

    public TagRegistry tags() {
        return tags;
    }

    /** Units accepted by the filter, in discovery order. */
    public List<TestUnit> select(DiscoveryFilter filter) {
        return units.stream().filter(filter::matches).toList();
    }

    /** True when any unit lives under a category directory. */
    public boolean usesDirectoryLayout() {
        return units.stream().anyMatch(unit ->
                CategoryResolver.directoryCategory(directoryOf(unit.source())).isPresent());
    }

    /** True when any unit carries a tag. */
    public boolean usesTagLayout() {
        return tags.hasAnyTags();
    }

    private static String directoryOf(String source) {
        int slash = source.lastIndexOf('/');
        return slash < 0 ? "" : source.substring(0, slash);
    }

    public static final class Builder {
        private final Map<String, TestUnit> units = new LinkedHashMap<>();
        private final TagRegistry.Builder tags = TagRegistry.builder();

        private Builder() {}

        public boolean contains(String unitId) {
            return units.containsKey(unitId);
        }

        /** Adds a unit unless one with the same id is already registered; returns whether it was added. */
        public boolean add(TestUnit unit) {
            if (units.containsKey(unit.id())) return false;
            units.put(unit.id(), unit);
            tags.register(unit.id(), unit.tags());
            return true;
        }

        public TestUnitRegistry build() {
            return new TestUnitRegistry(new ArrayList<>(units.values()), tags.build());
        }
    }
}
