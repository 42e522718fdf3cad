package com.seqflow.core;

/**
 * A pipeline was wired or parameterized incorrectly.
 *
 * <p>Configuration errors are detected before any task executes and abort the
 * whole run. They are never retried.
 */
public class ConfigurationException extends SeqflowException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
