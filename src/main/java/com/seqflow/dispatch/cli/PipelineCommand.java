package com.seqflow.dispatch.cli;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.engine.RunOptions;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.scheduler.RunReport;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * Shared flow of the pipeline commands: build the graph, run it, print the report.
 * Exit code 0 when every terminal task is COMPLETE, 1 when the run failed and 2
 * when the configuration was rejected before anything ran.
 */
public abstract class PipelineCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    @Mixin
    RunOptionsMixin runOptions = new RunOptionsMixin();

    @Option(names = "--output-root", required = true, description = "Folder receiving every output (local path or s3://bucket/prefix)")
    String outputRoot;

    private final PipelineEngine engine;

    protected PipelineCommand(PipelineEngine engine) {
        this.engine = engine;
    }

    protected abstract TaskGraph buildGraph();

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        RunReport report;
        try {
            TaskGraph graph = buildGraph();
            RunOptions options = runOptions.resolve(engine.defaultOptions());
            ConsoleOutput.info(graph.size() + " tasks, engine " + options.engine().name().toLowerCase()
                    + ", " + options.workers() + " workers");
            report = engine.run(graph, options, ConsoleOutput::watchEvent);
        } catch (ConfigurationException e) {
            ConsoleOutput.error("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        ConsoleOutput.report(report);
        return report.succeeded() ? EXIT_OK : EXIT_RUN_FAILED;
    }
}
