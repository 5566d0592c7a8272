package com.wobble.core.events;

public enum EventType {
    RUN_STARTED,
    TEST_STARTED,
    TEST_FINISHED,
    RUN_FINISHED
}
