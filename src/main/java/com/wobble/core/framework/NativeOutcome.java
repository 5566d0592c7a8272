package com.wobble.core.framework;

/**
 * Framework-native result of executing one test.
 *
 * @param kind   what happened
 * @param reason skip reason or failure message, may be {@code null}
 * @param cause  throwable raised by the test, {@code null} on success and for plain skips
 */
public record NativeOutcome(Kind kind, String reason, Throwable cause) {

    public enum Kind {
        SUCCESS,
        ASSERTION_FAILURE,
        ERROR,
        SKIPPED
    }

    public static NativeOutcome success() {
        return new NativeOutcome(Kind.SUCCESS, null, null);
    }

    public static NativeOutcome assertionFailure(Throwable cause) {
        return new NativeOutcome(Kind.ASSERTION_FAILURE, cause.getMessage(), cause);
    }

    public static NativeOutcome error(Throwable cause) {
        return new NativeOutcome(Kind.ERROR, cause.getMessage(), cause);
    }

    public static NativeOutcome skipped(String reason) {
        return new NativeOutcome(Kind.SKIPPED, reason, null);
    }

    public static NativeOutcome skipped(String reason, Throwable cause) {
        return new NativeOutcome(Kind.SKIPPED, reason, cause);
    }
}
