package com.wobble.core.tags;

import com.wobble.core.model.TestCategory;
import com.wobble.core.model.TestTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;

/**
 * Reads the tag annotations declared on test classes and methods into {@link TestTags}.
 * <p>
 * Only called while a source is being loaded; after discovery, tags are looked up in the
 * {@link TagRegistry}.
 */
public final class TagReader {

    private static final Logger log = LoggerFactory.getLogger(TagReader.class);

    private TagReader() {}

    /**
     * Tags of a test method, with method-level labels overriding class-level ones.
     */
    public static TestTags read(Class<?> testClass, Method method) {
        return read(testClass).overriddenBy(read((AnnotatedElement) method));
    }

    public static TestTags read(AnnotatedElement element) {
        Regression regression = element.getAnnotation(Regression.class);
        Integration integration = element.getAnnotation(Integration.class);
        Development development = element.getAnnotation(Development.class);

        int declared = (regression != null ? 1 : 0) + (integration != null ? 1 : 0) + (development != null ? 1 : 0);
        if (declared > 1) {
            log.warn("{} declares {} category tags; using the first of regression, integration, development",
                    element, declared);
        }

        TestCategory category = null;
        String scope = null;
        String phase = null;
        if (regression != null) {
            category = TestCategory.REGRESSION;
        } else if (integration != null) {
            category = TestCategory.INTEGRATION;
            scope = blankToNull(integration.scope());
        } else if (development != null) {
            category = TestCategory.DEVELOPMENT;
            phase = blankToNull(development.phase());
        }

        return new TestTags(category, scope, phase,
                element.isAnnotationPresent(Slow.class),
                element.isAnnotationPresent(SkipCi.class));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
