package com.wobble.dispatch.cli;

/**
 * Invalid combination of requested options, detected before any test runs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
