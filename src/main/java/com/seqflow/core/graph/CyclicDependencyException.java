package com.seqflow.core.graph;

import com.seqflow.core.ConfigurationException;

import java.util.List;

public class CyclicDependencyException extends ConfigurationException {

    private final List<String> tasks;

    public CyclicDependencyException(List<String> tasks) {
        super("Task graph contains a cycle through: " + String.join(", ", tasks));
        this.tasks = List.copyOf(tasks);
    }

    /** Names of the tasks that could not be ordered. */
    public List<String> tasks() {
        return tasks;
    }
}
