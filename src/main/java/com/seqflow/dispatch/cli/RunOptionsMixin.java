package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.RunOptions;
import com.seqflow.core.scheduler.Engine;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Execution flags shared by every pipeline command. Unset flags fall back to configuration.
 */
public class RunOptionsMixin {

    @Option(names = "--engine", description = "Where containers run: docker or batch")
    String engine;

    @Option(names = "--workers", description = "Maximum number of tasks in flight")
    Integer workers;

    @Option(names = "--max-attempts", description = "Attempts per task before it is marked FAILED")
    Integer maxAttempts;

    @Option(names = "--batch-queue", description = "Batch queue for the batch engine")
    String batchQueue;

    @Option(names = "--job-role", description = "Role attached to batch jobs")
    String jobRole;

    @Option(names = "--scratch-root", description = "Host folder for per-task scratch space")
    Path scratchRoot;

    @Option(names = "--report-file", description = "Write the run report as JSON to this file")
    Path reportFile;

    RunOptions resolve(RunOptions defaults) {
        return new RunOptions(
                engine != null ? Engine.parse(engine) : defaults.engine(),
                workers != null ? workers : defaults.workers(),
                maxAttempts != null ? maxAttempts : defaults.maxAttempts(),
                batchQueue != null ? batchQueue : defaults.batchQueue(),
                jobRole != null ? jobRole : defaults.jobRole(),
                scratchRoot != null ? scratchRoot : defaults.scratchRoot(),
                reportFile != null ? reportFile : defaults.reportFile());
    }
}
