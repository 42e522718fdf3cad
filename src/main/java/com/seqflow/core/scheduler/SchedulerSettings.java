package com.seqflow.core.scheduler;

/**
 * @param concurrency worker pool size
 * @param maxAttempts attempts per task, 1 disables retries
 * @param engine      where container tasks run
 */
public record SchedulerSettings(int concurrency, int maxAttempts, Engine engine) {

    public SchedulerSettings {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1, got " + concurrency);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (engine == null) {
            engine = Engine.DOCKER;
        }
    }
}
