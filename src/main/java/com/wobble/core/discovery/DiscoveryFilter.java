package com.wobble.core.discovery;

import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestUnit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Selection applied to discovered units.
 *
 * @param categories  requested categories; empty means every category, uncategorized included
 * @param excludeSlow drop units tagged slow
 * @param excludeCi   drop units tagged to skip in CI
 */
public record DiscoveryFilter(Set<TestCategory> categories, boolean excludeSlow, boolean excludeCi) {

    public DiscoveryFilter {
        categories = categories == null || categories.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(categories));
    }

    public static DiscoveryFilter all() {
        return new DiscoveryFilter(Set.of(), false, false);
    }

    public static DiscoveryFilter of(TestCategory... categories) {
        return new DiscoveryFilter(categories.length == 0 ? Set.of() : EnumSet.of(categories[0], categories), false, false);
    }

    public boolean includesAllCategories() {
        return categories.isEmpty();
    }

    public boolean matches(TestUnit unit) {
        if (!categories.isEmpty() && !categories.contains(unit.category())) return false;
        if (excludeSlow && unit.slow()) return false;
        if (excludeCi && unit.skipCi()) return false;
        return true;
    }
}
