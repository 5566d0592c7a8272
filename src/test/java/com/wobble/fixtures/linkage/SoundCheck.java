package com.wobble.fixtures.linkage;

import com.wobble.core.tags.Regression;
import org.junit.jupiter.api.Test;

public class SoundCheck {

    @Test
    @Regression
    void unaffected() {
    }
}
