package com.wobble.fixtures.outcomes;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Disabled;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OutcomeCheck {

    @Test
    void assertionFails() {
        assertEquals(2, 1 + 2, "sum is off");
    }

    @Disabled("not ready")
    @Test
    void disabledTest() {
        throw new IllegalStateException("must not run");
    }

    @Test
    void passes() {
        assertEquals(3, 1 + 2);
    }

    @Test
    void skipsOnAssumption() {
        Assumptions.assumeTrue(false, "no network");
    }

    @Test
    void throwsUnexpectedly() {
        throw new IllegalStateException("boom");
    }
}
