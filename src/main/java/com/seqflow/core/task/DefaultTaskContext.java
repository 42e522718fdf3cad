package com.seqflow.core.task;

import com.seqflow.core.target.Target;

import java.util.List;
import java.util.Map;

public class DefaultTaskContext implements TaskContext {

    private final String runId;
    private final Task task;
    private final Map<String, List<Target>> inputs;

    public DefaultTaskContext(String runId, Task task, Map<String, List<Target>> inputs) {
        this.runId = runId;
        this.task = task;
        this.inputs = inputs;
    }

    @Override
    public String runId() {
        return runId;
    }

    @Override
    public Target input(String slot) {
        List<Target> bound = inputs(slot);
        if (bound.size() != 1) {
            throw new IllegalArgumentException("Input '" + slot + "' of " + task.name()
                    + " has " + bound.size() + " bindings, expected 1");
        }
        return bound.get(0);
    }

    @Override
    public List<Target> inputs(String slot) {
        return inputs.getOrDefault(slot, List.of());
    }

    @Override
    public Target output(String slot) {
        Target target = task.outputs().get(slot);
        if (target == null) {
            throw new IllegalArgumentException("Unknown output '" + slot + "' of " + task.name());
        }
        return target;
    }
}
