package com.seqflow.core.task;

import com.seqflow.core.target.Target;

import java.util.List;
import java.util.Map;

/**
 * A unit of work with declared inputs and outputs.
 *
 * <p>Outputs are derived from the task's parameters only. A task is complete
 * when every declared output exists; the scheduler never runs a complete task.
 */
public interface Task {

    TaskId id();

    default String name() {
        return id().name();
    }

    List<InputSlot> inputSlots();

    /**
     * Output targets by slot name. Must not perform I/O.
     */
    Map<String, Target> outputs();

    TaskKind kind();

    /**
     * True when the task declares outputs and all of them exist. A task
     * without outputs is never complete, so it runs on every invocation.
     */
    default boolean isComplete() {
        return !outputs().isEmpty() && outputsPresent();
    }

    /**
     * True when every declared output exists; trivially true without outputs.
     * Used to validate a finished run.
     */
    default boolean outputsPresent() {
        for (Target target : outputs().values()) {
            if (!target.exists()) {
                return false;
            }
        }
        return true;
    }

    default OutputRef ref(String outputSlot) {
        return new OutputRef(this, outputSlot);
    }
}
