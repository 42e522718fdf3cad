package com.seqflow.sandbox;

import com.seqflow.core.SeqflowException;

/**
 * A container command exited with a non-zero status.
 */
public class ContainerExecutionException extends SeqflowException {

    private final int exitCode;
    private final String output;

    public ContainerExecutionException(String taskName, int exitCode, String output) {
        super("Task " + taskName + " exited with code " + exitCode);
        this.exitCode = exitCode;
        this.output = output != null ? output : "";
    }

    public int exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
