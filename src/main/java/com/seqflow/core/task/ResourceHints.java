package com.seqflow.core.task;

/**
 * CPU and memory requested for a container task.
 */
public record ResourceHints(int cpus, int memoryMb) {

    public static final ResourceHints DEFAULT = new ResourceHints(1, 1024);

    public ResourceHints {
        if (cpus < 1) {
            throw new IllegalArgumentException("cpus must be >= 1, got " + cpus);
        }
        if (memoryMb < 1) {
            throw new IllegalArgumentException("memoryMb must be >= 1, got " + memoryMb);
        }
    }
}
