package com.seqflow.core.target;

import com.seqflow.core.SeqflowException;

/**
 * A target could not be read or written: transport or auth failure against its
 * store, or an input that is missing when a task needs it.
 * {@link Target#exists()} never reports a missing object this way.
 */
public class TargetAccessException extends SeqflowException {
    public TargetAccessException(String message) {
        super(message);
    }

    public TargetAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
