package com.seqflow.core.task;

import java.util.List;

/**
 * Base class deriving the task identity from the concrete class, a name and parameters.
 */
public abstract class AbstractTask implements Task {

    private final TaskId id;

    protected AbstractTask(String name, Parameters parameters) {
        this.id = new TaskId(getClass().getSimpleName(), name, parameters);
    }

    @Override
    public TaskId id() {
        return id;
    }

    public Parameters parameters() {
        return id.parameters();
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Task other && id.equals(other.id());
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id.type() + "(" + id.name() + ")";
    }
}
