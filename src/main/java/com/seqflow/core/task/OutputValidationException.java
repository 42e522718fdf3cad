package com.seqflow.core.task;

import com.seqflow.core.SeqflowException;

/**
 * A task finished without leaving every declared output behind.
 */
public class OutputValidationException extends SeqflowException {

    public OutputValidationException(String message) {
        super(message);
    }
}
