package com.wobble.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One discoverable, independently executable test case.
 * <p>
 * Created once during discovery and never modified afterwards. Units that stand for a source that
 * could not be loaded have no handle and carry the {@link #loadFailure() load failure} instead.
 *
 * @param id             qualified identity, {@code pkg.Class#method} (or {@code pkg.Class} for load failures)
 * @param className      fully qualified class name
 * @param methodName     test method name, {@code null} for load failures
 * @param source         location of the source relative to the classes root, using {@code /}
 * @param category       resolved category
 * @param categorySource where {@link #category} came from
 * @param scope          integration scope or {@code null}
 * @param phase          development phase or {@code null}
 * @param slow           slow flag
 * @param skipCi         ci-skip flag
 * @param handle         executable handle, {@code null} for load failures
 * @param loadFailure    why the source could not be loaded, {@code null} for regular units
 */
public record TestUnit(
    String id,
    String className,
    String methodName,
    String source,
    TestCategory category,
    CategorySource categorySource,
    String scope,
    String phase,
    boolean slow,
    boolean skipCi,
    TestHandle handle,
    ErrorDetail loadFailure
) {

    public TestUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(categorySource, "categorySource");
        if ((handle == null) == (loadFailure == null)) {
            throw new IllegalArgumentException("A test unit has either a handle or a load failure: " + id);
        }
    }

    public static TestUnit loadFailure(String className, String source, TestCategory category,
                                       CategorySource categorySource, ErrorDetail failure) {
        return new TestUnit(className, className, null, source, category, categorySource,
                null, null, false, false, null, failure);
    }

    public boolean isLoadFailure() {
        return loadFailure != null;
    }

    /** Simple class name without package. */
    public String simpleClassName() {
        int dot = className.lastIndexOf('.');
        return dot < 0 ? className : className.substring(dot + 1);
    }

    /** Human-readable {@code Class.method} name. */
    public String displayName() {
        return methodName == null ? simpleClassName() : simpleClassName() + "." + methodName;
    }

    public Optional<String> scopeLabel() {
        return Optional.ofNullable(scope);
    }

    public Optional<String> phaseLabel() {
        return Optional.ofNullable(phase);
    }

    public TestTags tags() {
        return new TestTags(categorySource == CategorySource.TAG ? category : null, scope, phase, slow, skipCi);
    }
}
