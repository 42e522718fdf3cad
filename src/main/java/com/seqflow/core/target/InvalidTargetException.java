package com.seqflow.core.target;

import com.seqflow.core.ConfigurationException;

/**
 * A target location could not be parsed, or names a scheme with no registered store.
 */
public class InvalidTargetException extends ConfigurationException {
    public InvalidTargetException(String message) {
        super(message);
    }
}
