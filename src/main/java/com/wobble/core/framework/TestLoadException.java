package com.wobble.core.framework;

/**
 * A test source could not be loaded (missing class, failed static initialization, linkage error).
 */
public class TestLoadException extends Exception {

    private final String className;

    public TestLoadException(String className, String message, Throwable cause) {
        super(message, cause);
        this.className = className;
    }

    public String getClassName() {
        return className;
    }
}
