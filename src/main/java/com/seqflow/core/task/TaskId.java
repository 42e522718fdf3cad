package com.seqflow.core.task;

/**
 * Identity of a task. Two tasks with the same type, name and parameters
 * describe the same work and the same output locations.
 */
public record TaskId(String type, String name, Parameters parameters) {

    public TaskId {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
        if (parameters == null) {
            parameters = Parameters.empty();
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
