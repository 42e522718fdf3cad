package com.seqflow.core.engine;

import com.seqflow.core.scheduler.Engine;

import java.nio.file.Path;

/**
 * Per-run settings, usually taken from command-line flags.
 *
 * @param engine      where container tasks run
 * @param workers     maximum number of tasks in flight
 * @param maxAttempts attempts per task, at least 1
 * @param batchQueue  batch queue, used by the batch engine
 * @param jobRole     batch job role, may be blank
 * @param scratchRoot scratch root override for the docker engine, nullable
 * @param reportFile  where to write the JSON run report, nullable
 */
public record RunOptions(
    Engine engine,
    int workers,
    int maxAttempts,
    String batchQueue,
    String jobRole,
    Path scratchRoot,
    Path reportFile
) {
    public RunOptions {
        engine = engine != null ? engine : Engine.DOCKER;
        jobRole = jobRole != null ? jobRole : "";
    }
}
