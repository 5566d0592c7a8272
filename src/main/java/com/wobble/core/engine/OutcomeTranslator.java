package com.wobble.core.engine;

import com.wobble.core.framework.NativeOutcome;
import com.wobble.core.model.TestStatus;

/**
 * Maps framework-native outcomes to wobble statuses.
 */
final class OutcomeTranslator {

    private OutcomeTranslator() {}

    static TestStatus toStatus(NativeOutcome outcome) {
        if (outcome == null || outcome.kind() == null) {
            return TestStatus.ERRORED;
        }
        return switch (outcome.kind()) {
            case SUCCESS -> TestStatus.PASSED;
            case ASSERTION_FAILURE -> TestStatus.FAILED;
            case ERROR -> TestStatus.ERRORED;
            case SKIPPED -> TestStatus.SKIPPED;
        };
    }
}
