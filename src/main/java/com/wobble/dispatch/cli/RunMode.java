package com.wobble.dispatch.cli;

public enum RunMode {
    RUN,
    DISCOVER_ONLY,
    LIST_CATEGORIES
}
