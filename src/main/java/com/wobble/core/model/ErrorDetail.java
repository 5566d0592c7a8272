package com.wobble.core.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Text form of a throwable captured while loading or running a test unit.
 *
 * @param type     simple name of the exception class
 * @param message  exception message, never {@code null}
 * @param trace    full stack trace text
 * @param location first stack frame inside the test class ({@code File.java:42}), or {@code null}
 */
public record ErrorDetail(String type, String message, String trace, String location) {

    public static ErrorDetail from(Throwable t) {
        return from(t, null);
    }

    /**
     * @param t         the throwable to capture
     * @param className test class whose frames identify the failure location, may be {@code null}
     */
    public static ErrorDetail from(Throwable t, String className) {
        StringWriter buffer = new StringWriter();
        t.printStackTrace(new PrintWriter(buffer));
        String message = t.getMessage() != null ? t.getMessage() : "";
        return new ErrorDetail(t.getClass().getSimpleName(), message, buffer.toString(),
                locate(t, className));
    }

    /** {@code Type: message}, or just the type when there is no message. */
    public String summary() {
        return message.isEmpty() ? type : type + ": " + message;
    }

    private static String locate(Throwable t, String className) {
        if (className == null) return null;
        for (StackTraceElement frame : t.getStackTrace()) {
            if (className.equals(frame.getClassName()) && frame.getFileName() != null) {
                return frame.getFileName() + ":" + frame.getLineNumber();
            }
        }
        return null;
    }
}
