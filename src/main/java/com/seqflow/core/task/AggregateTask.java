package com.seqflow.core.task;

/**
 * Marks a fan-in task whose inputs are collections of per-sample outputs.
 * At least one of its input slots accepts multiple bindings.
 */
public interface AggregateTask extends Task {
}
