package com.seqflow.core.scheduler;

import com.seqflow.core.SeqflowException;

/**
 * A remote backend call failed in a way that may succeed when repeated
 * (transport error, throttling, backend briefly unavailable).
 */
public class TransientBackendException extends SeqflowException {
    public TransientBackendException(String message) {
        super(message);
    }

    public TransientBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
