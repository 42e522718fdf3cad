package com.seqflow.pipelines;

import com.seqflow.core.SeqflowException;

/**
 * A downloaded genome file cannot be combined with the others.
 */
public class InvalidGenomeDataException extends SeqflowException {

    public InvalidGenomeDataException(String message) {
        super(message);
    }
}
