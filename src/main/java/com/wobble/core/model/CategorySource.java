package com.wobble.core.model;

/**
 * Where a unit's category came from.
 */
public enum CategorySource {
    TAG,
    DIRECTORY,
    DEFAULT
}
