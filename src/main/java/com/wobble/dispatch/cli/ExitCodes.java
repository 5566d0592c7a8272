package com.wobble.dispatch.cli;

/**
 * Process exit codes of the {@code wobble} command.
 */
public final class ExitCodes {

    /** Every executed test passed; skips are allowed. */
    public static final int OK = 0;
    /** At least one test failed or errored. */
    public static final int TEST_FAILURES = 1;
    /** Invalid options, unknown category or missing path. Nothing was executed. */
    public static final int CONFIGURATION = 2;
    /** Unexpected internal fault. */
    public static final int INTERNAL = 3;
    /** The run was interrupted. */
    public static final int INTERRUPTED = 130;

    private ExitCodes() {}
}
