package com.seqflow.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seqflow.batch.BatchBackend;
import com.seqflow.batch.BatchProperties;
import com.seqflow.batch.BatchSubmitter;
import com.seqflow.core.events.EventBus;
import com.seqflow.core.events.PipelineEvent;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.scheduler.Engine;
import com.seqflow.core.scheduler.RunReport;
import com.seqflow.core.scheduler.Scheduler;
import com.seqflow.core.scheduler.SchedulerProperties;
import com.seqflow.core.scheduler.SchedulerSettings;
import com.seqflow.core.target.TargetAccessException;
import com.seqflow.sandbox.ContainerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Runs a task graph with per-run options: builds the scheduler for the chosen
 * engine, forwards events to the caller, aborts on JVM shutdown and writes the
 * JSON report.
 */
@Service
public class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final ContainerExecutor executor;
    private final ObjectProvider<BatchBackend> batchBackend;
    private final BatchProperties batchProperties;
    private final SchedulerProperties schedulerProperties;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;

    public PipelineEngine(ContainerExecutor executor,
                          ObjectProvider<BatchBackend> batchBackend,
                          BatchProperties batchProperties,
                          SchedulerProperties schedulerProperties,
                          EventBus eventBus,
                          PipelineMetrics metrics) {
        this.executor = executor;
        this.batchBackend = batchBackend;
        this.batchProperties = batchProperties;
        this.schedulerProperties = schedulerProperties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Options populated from configuration, used where a flag is not given.
     */
    public RunOptions defaultOptions() {
        return new RunOptions(
                Engine.parse(schedulerProperties.getEngine()),
                schedulerProperties.getWorkers(),
                schedulerProperties.getMaxAttempts(),
                batchProperties.getQueue(),
                batchProperties.getJobRole(),
                null,
                null);
    }

    public RunReport run(TaskGraph graph, RunOptions options, Consumer<PipelineEvent> listener) {
        var settings = new SchedulerSettings(options.workers(), options.maxAttempts(), options.engine());
        BatchSubmitter submitter = options.engine() == Engine.BATCH ? createSubmitter(options) : null;
        ContainerExecutor runExecutor = options.scratchRoot() != null
                ? executor.withScratchRoot(options.scratchRoot()) : executor;
        var scheduler = new Scheduler(settings, runExecutor, submitter, eventBus, metrics);

        EventBus.Subscription subscription = eventBus.subscribe(scheduler.runId(), listener);
        Thread hook = new Thread(scheduler::abort, "seqflow-shutdown-" + scheduler.runId());
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            RunReport report = scheduler.run(graph);
            if (options.reportFile() != null) {
                writeReport(report, options.reportFile());
            }
            return report;
        } finally {
            subscription.unsubscribe();
            removeHook(hook);
            if (submitter != null) {
                submitter.close();
            }
        }
    }

    public void writeReport(RunReport report, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), report);
            log.info("Run report written to {}", file);
        } catch (IOException e) {
            throw new TargetAccessException("Could not write run report to " + file, e);
        }
    }

    private BatchSubmitter createSubmitter(RunOptions options) {
        BatchBackend backend = batchBackend.getIfAvailable();
        if (backend == null) {
            return null;
        }
        return new BatchSubmitter(backend, batchProperties, options.batchQueue(), options.jobRole(), metrics);
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, keeping abort hook");
        }
    }
}
