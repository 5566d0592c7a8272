package com.wobble.core.framework;

import com.wobble.core.model.TestHandle;

import java.lang.reflect.Method;
import java.util.List;

/**
 * Handle to a test method loaded by {@link ReflectiveTestFramework}.
 *
 * @param testClass      declaring class, instantiated once per execution
 * @param method         the {@code @Test} method
 * @param beforeEach     {@code @BeforeEach} methods, superclass first
 * @param afterEach      {@code @AfterEach} methods, subclass first
 * @param disabledReason reason from {@code @Disabled}, or {@code null} when enabled
 */
record ReflectiveHandle(
    Class<?> testClass,
    Method method,
    List<Method> beforeEach,
    List<Method> afterEach,
    String disabledReason
) implements TestHandle {

    @Override
    public String id() {
        return testClass.getName() + "#" + method.getName();
    }
}
