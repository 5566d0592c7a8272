package com.wobble.core.model;

/**
 * Opaque reference to the executable behind a test unit. Only the framework that produced a handle
 * knows how to run it.
 */
public interface TestHandle {

    /** Identity of the callable, stable across discoveries of an unchanged tree. */
    String id();
}
