package com.seqflow.core.task;

@FunctionalInterface
public interface TaskStateListener {

    TaskStateListener NONE = (task, state) -> { };

    void onStateChange(Task task, TaskState state);
}
