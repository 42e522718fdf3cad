package com.seqflow.core.scheduler;

import com.seqflow.core.task.TaskState;

/**
 * Final state of one task in a run.
 *
 * @param name      task name
 * @param type      task type
 * @param state     COMPLETE, FAILED or UNREACHABLE
 * @param skipped   COMPLETE without executing because the outputs already existed
 * @param attempts  number of attempts started
 * @param message   failure description, empty on success
 * @param output    captured command output, if any
 * @param elapsedMs wall-clock time of the last attempt
 */
public record TaskOutcome(
    String name,
    String type,
    TaskState state,
    boolean skipped,
    int attempts,
    String message,
    String output,
    long elapsedMs
) {}
