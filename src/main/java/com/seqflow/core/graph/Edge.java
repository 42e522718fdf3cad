package com.seqflow.core.graph;

import com.seqflow.core.task.TaskId;

/**
 * Binding of a consumer's input slot to a producer's output slot.
 */
public record Edge(TaskId consumer, String inputSlot, TaskId producer, String outputSlot) {

    @Override
    public String toString() {
        return producer.name() + "." + outputSlot + " -> " + consumer.name() + "." + inputSlot;
    }
}
