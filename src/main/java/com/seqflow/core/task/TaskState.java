package com.seqflow.core.task;

public enum TaskState {
    PENDING,
    RESOLVING_INPUTS,
    RUNNING,
    PUBLISHING,
    COMPLETE,
    FAILED,
    UNREACHABLE;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == UNREACHABLE;
    }
}
