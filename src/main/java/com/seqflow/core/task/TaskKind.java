package com.seqflow.core.task;

/**
 * How the scheduler executes a task.
 */
public enum TaskKind {
    /** Pre-existing data; never executed. */
    EXTERNAL,
    /** In-process work on a scheduler worker. */
    LOCAL,
    /** Command run inside a container image. */
    CONTAINER
}
