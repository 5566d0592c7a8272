package com.wobble.core.model;

import java.util.Optional;

/**
 * Immutable label set attached to a test unit.
 *
 * @param category declared category, or {@code null} when the unit carries no category tag
 * @param scope    integration scope (only meaningful for integration units), or {@code null}
 * @param phase    development phase (only meaningful for development units), or {@code null}
 * @param slow     whether the unit is marked slow
 * @param skipCi   whether the unit should be skipped in CI
 */
public record TestTags(
    TestCategory category,
    String scope,
    String phase,
    boolean slow,
    boolean skipCi
) {

    public static final TestTags NONE = new TestTags(null, null, null, false, false);

    public Optional<TestCategory> declaredCategory() {
        return Optional.ofNullable(category);
    }

    public boolean isEmpty() {
        return category == null && scope == null && phase == null && !slow && !skipCi;
    }

    /**
     * Returns a label set where every label present in {@code override} replaces the one here.
     * Flags are additive.
     */
    public TestTags overriddenBy(TestTags override) {
        if (override == null || override.isEmpty()) return this;
        if (override.category != null) {
            return new TestTags(override.category, override.scope, override.phase,
                    slow || override.slow, skipCi || override.skipCi);
        }
        return new TestTags(category, scope, phase, slow || override.slow, skipCi || override.skipCi);
    }
}
