package com.wobble.fixtures.hierarchy.integration;

import com.wobble.core.tags.SkipCi;
import com.wobble.core.tags.Slow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

public class NightlyCheck {

    @Test
    void quickSmoke() {
        assertTrue(true);
    }

    @Slow
    @Test
    void fullReindex() {
        assertTrue(true);
    }

    @SkipCi
    @Test
    void needsLocalDatabase() {
        assertTrue(true);
    }
}
