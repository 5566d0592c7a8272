package com.wobble.core.model;

/**
 * Final status of one executed test unit.
 * FAILED is an assertion mismatch, ERRORED an unexpected fault; the two are never merged.
 */
public enum TestStatus {
    PASSED("PASS", '.'),
    FAILED("FAIL", 'F'),
    ERRORED("ERROR", 'E'),
    SKIPPED("SKIP", 's');

    private final String label;
    private final char symbol;

    TestStatus(String label, char symbol) {
        this.label = label;
        this.symbol = symbol;
    }

    public String label() {
        return label;
    }

    /** Single character used by the minimal console format. */
    public char symbol() {
        return symbol;
    }

    public boolean isProblem() {
        return this == FAILED || this == ERRORED;
    }
}
