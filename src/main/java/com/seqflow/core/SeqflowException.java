package com.seqflow.core;

/**
 * Base type for every error raised by the pipeline substrate.
 */
public class SeqflowException extends RuntimeException {
    public SeqflowException(String message) {
        super(message);
    }

    public SeqflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
