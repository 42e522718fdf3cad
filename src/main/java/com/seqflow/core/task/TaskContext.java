package com.seqflow.core.task;

import com.seqflow.core.target.Target;

import java.util.List;

/**
 * Resolved inputs and outputs handed to a {@link LocalTask} at run time.
 */
public interface TaskContext {

    String runId();

    /**
     * The single target bound to a slot.
     *
     * @throws IllegalArgumentException when the slot is unbound or bound more than once
     */
    Target input(String slot);

    List<Target> inputs(String slot);

    Target output(String slot);
}
