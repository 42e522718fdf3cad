package com.seqflow.core.task;

/**
 * Task whose work runs in-process on a scheduler worker.
 * Implementations must leave either every output or none behind.
 */
public abstract class LocalTask extends AbstractTask {

    protected LocalTask(String name, Parameters parameters) {
        super(name, parameters);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.LOCAL;
    }

    public abstract void run(TaskContext context) throws Exception;
}
