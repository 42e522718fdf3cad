package com.seqflow.core.task;

/**
 * Reference to one named output of a producer task, used when wiring a graph.
 */
public record OutputRef(Task producer, String slot) {
}
