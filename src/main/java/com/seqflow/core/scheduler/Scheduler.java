package com.seqflow.core.scheduler;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.events.EventBus;
import com.seqflow.core.events.PipelineEvent;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.logging.MdcContext;
import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetAccessException;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.DefaultTaskContext;
import com.seqflow.core.task.LocalTask;
import com.seqflow.core.task.OutputValidationException;
import com.seqflow.core.task.Task;
import com.seqflow.core.task.TaskId;
import com.seqflow.core.task.TaskState;
import com.seqflow.sandbox.ContainerExecutionException;
import com.seqflow.sandbox.ContainerExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a task graph to completion.
 *
 * <p>A task becomes ready once every producer is COMPLETE. Ready tasks are handed
 * to a fixed pool of workers; each worker first checks whether the task's outputs
 * already exist and skips it if so. Container tasks run through the
 * {@link ContainerExecutor} (docker engine) or a {@link RemoteExecutor} (batch
 * engine), in which case the worker is released as soon as the job is submitted.
 *
 * <p>A failed task makes every task downstream of it UNREACHABLE; unrelated
 * subtrees keep running. Completions are funneled through a queue consumed by
 * the calling thread, which owns all scheduling state.
 *
 * <p>An instance is meant for one run; {@link #abort()} is permanent.
 */
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final SchedulerSettings settings;
    private final ContainerExecutor executor;
    private final RemoteExecutor remote;
    private final EventBus events;
    private final PipelineMetrics metrics;
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final String runId;

    /**
     * @param executor required for the docker engine, may be null for batch runs
     * @param remote   required for the batch engine
     * @param metrics  nullable
     */
    public Scheduler(SchedulerSettings settings, ContainerExecutor executor, RemoteExecutor remote,
                     EventBus events, PipelineMetrics metrics) {
        if (settings.engine() == Engine.BATCH && remote == null) {
            throw new ConfigurationException("Batch engine selected but no batch backend is configured");
        }
        if (settings.engine() == Engine.DOCKER && executor == null) {
            throw new ConfigurationException("Docker engine selected but no container executor is configured");
        }
        this.settings = settings;
        this.executor = executor;
        this.remote = remote;
        this.events = events != null ? events : new EventBus();
        this.metrics = metrics;
        this.runId = UUID.randomUUID().toString().substring(0, 8);
    }

    public String runId() {
        return runId;
    }

    /**
     * Stops dispatching new tasks and cancels in-flight remote jobs.
     * Tasks that never started are reported UNREACHABLE.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            log.warn("Run {} aborted, no further tasks will be dispatched", runId);
            if (remote != null) {
                remote.cancelAll();
            }
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public RunReport run(TaskGraph graph) {
        Instant startedAt = Instant.now();
        MdcContext.setRun(runId);
        try {
            log.info("Run {} started: {} tasks, engine={}, workers={}, maxAttempts={}",
                    runId, graph.size(), settings.engine(), settings.concurrency(), settings.maxAttempts());
            events.publish(PipelineEvent.run("run.started", runId, Map.of(
                    "tasks", graph.size(),
                    "engine", settings.engine().name(),
                    "workers", settings.concurrency())));

            List<TaskOutcome> outcomes = graph.isEmpty() ? List.of() : new Run(graph).execute();
            if (graph.isEmpty()) {
                log.warn("Run {} has no tasks", runId);
            }

            List<String> terminal = graph.terminalTasks().stream().map(Task::name).toList();
            var report = new RunReport(runId, startedAt, Instant.now(), terminal, outcomes);
            log.info("Run {} {}: {} executed, {} skipped, {} failed, {} unreachable",
                    runId, report.succeeded() ? "succeeded" : "failed", report.executedCount(),
                    report.skippedCount(), report.failed().size(), report.unreachable().size());
            if (metrics != null) {
                metrics.recordRunResult(report.succeeded());
            }
            events.publish(PipelineEvent.run("run.completed", runId, Map.of(
                    "succeeded", report.succeeded(),
                    "executed", report.executedCount(),
                    "skipped", report.skippedCount(),
                    "failed", report.failed().size(),
                    "unreachable", report.unreachable().size())));
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Result of one attempt, produced on a worker and handled by the coordinator.
     */
    private record Completion(Task task, int attempt, boolean success, boolean skipped, boolean abandoned,
                              String output, Throwable error, long elapsedMs) {

        static Completion succeeded(Task task, int attempt, boolean skipped, String output, long elapsedMs) {
            return new Completion(task, attempt, true, skipped, false, output, null, elapsedMs);
        }

        static Completion failed(Task task, int attempt, Throwable error, long elapsedMs) {
            return new Completion(task, attempt, false, false, false, outputOf(error), error, elapsedMs);
        }

        static Completion abandoned(Task task, int attempt) {
            return new Completion(task, attempt, false, false, true, "", null, 0);
        }
    }

    /**
     * Scheduling state of a single run. Only the coordinator thread touches the
     * non-concurrent fields.
     */
    private final class Run {

        private final TaskGraph graph;
        private final Map<TaskId, TaskState> states = new ConcurrentHashMap<>();
        private final Map<TaskId, Integer> waitingOn = new HashMap<>();
        private final Map<TaskId, Integer> attempts = new HashMap<>();
        private final Map<TaskId, TaskOutcome> outcomes = new LinkedHashMap<>();
        private final Deque<Task> ready = new ArrayDeque<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
        private final ExecutorService workers;
        private int pending;

        Run(TaskGraph graph) {
            this.graph = graph;
            this.workers = Executors.newFixedThreadPool(
                    Math.min(settings.concurrency(), graph.size()), workerThreads());
        }

        List<TaskOutcome> execute() {
            for (Task task : graph.topologicalOrder()) {
                states.put(task.id(), TaskState.PENDING);
                int producers = graph.producersOf(task.id()).size();
                waitingOn.put(task.id(), producers);
                if (producers == 0) {
                    ready.add(task);
                }
            }

            try {
                while (true) {
                    while (!ready.isEmpty()) {
                        Task task = ready.poll();
                        if (aborted.get()) {
                            markUnreachable(task, "run aborted");
                        } else {
                            dispatch(task);
                        }
                    }
                    if (pending == 0) {
                        break;
                    }
                    Completion completion = completions.take();
                    pending--;
                    handle(completion);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort();
            } finally {
                shutdownWorkers();
            }

            for (Task task : graph.topologicalOrder()) {
                if (!outcomes.containsKey(task.id())) {
                    markUnreachable(task, "run aborted");
                }
            }
            var ordered = new ArrayList<TaskOutcome>(outcomes.size());
            for (Task task : graph.topologicalOrder()) {
                ordered.add(outcomes.get(task.id()));
            }
            return ordered;
        }

        private void dispatch(Task task) {
            int attempt = attempts.merge(task.id(), 1, Integer::sum);
            states.put(task.id(), TaskState.PENDING);
            pending++;
            workers.execute(() -> {
                Completion completion = work(task, attempt);
                if (completion != null) {
                    completions.add(completion);
                }
            });
        }

        /**
         * Runs on a worker thread. Returns null when the result will arrive asynchronously.
         */
        private Completion work(Task task, int attempt) {
            MdcContext.setTask(runId, task.name(), task.id().type());
            long startMs = System.currentTimeMillis();
            try {
                if (aborted.get()) {
                    return Completion.abandoned(task, attempt);
                }
                if (task.isComplete()) {
                    log.info("Task {} already complete, skipping", task.name());
                    return Completion.succeeded(task, attempt, true, "", System.currentTimeMillis() - startMs);
                }
                log.info("Starting task {} (attempt {}/{})", task.name(), attempt, settings.maxAttempts());
                events.publish(PipelineEvent.task("task.started", runId, task.name(),
                        Map.of("type", task.id().type(), "attempt", attempt)));

                switch (task.kind()) {
                    case EXTERNAL -> throw new TargetAccessException("External input of task " + task.name()
                            + " does not exist: " + task.outputs().values());
                    case LOCAL -> {
                        return runLocal((LocalTask) task, attempt, startMs);
                    }
                    case CONTAINER -> {
                        var container = (ContainerTask) task;
                        if (settings.engine() == Engine.BATCH) {
                            submitRemote(container, attempt, startMs);
                            return null;
                        }
                        var result = executor.execute(container, graph.inputsOf(task.id()), this::onStateChange);
                        return Completion.succeeded(task, attempt, false, result.output(),
                                System.currentTimeMillis() - startMs);
                    }
                    default -> throw new IllegalStateException("Unknown task kind " + task.kind());
                }
            } catch (Exception e) {
                return Completion.failed(task, attempt, e, System.currentTimeMillis() - startMs);
            } finally {
                MdcContext.clear();
            }
        }

        private Completion runLocal(LocalTask task, int attempt, long startMs) throws Exception {
            onStateChange(task, TaskState.RUNNING);
            try {
                task.run(new DefaultTaskContext(runId, task, graph.inputsOf(task.id())));
            } catch (Exception e) {
                discardOutputs(task, e);
                throw e;
            }
            if (!task.outputsPresent()) {
                discardOutputs(task, null);
                throw new OutputValidationException("Task " + task.name() + " finished without producing all outputs");
            }
            return Completion.succeeded(task, attempt, false, "", System.currentTimeMillis() - startMs);
        }

        /** Removes whatever a failed run left at its outputs so a later run does not take it as done. */
        private void discardOutputs(Task task, Exception failure) {
            for (Target output : task.outputs().values()) {
                try {
                    output.delete();
                } catch (IOException | RuntimeException e) {
                    log.warn("Could not remove output {} of failed task {}: {}", output, task.name(), e.getMessage());
                    if (failure != null) {
                        failure.addSuppressed(e);
                    }
                }
            }
        }

        private void submitRemote(ContainerTask task, int attempt, long startMs) {
            onStateChange(task, TaskState.RUNNING);
            remote.submit(task, graph.inputsOf(task.id())).whenCompleteAsync((output, error) -> {
                MdcContext.setTask(runId, task.name(), task.id().type());
                long elapsedMs = System.currentTimeMillis() - startMs;
                try {
                    if (error != null) {
                        completions.add(Completion.failed(task, attempt, unwrap(error), elapsedMs));
                    } else if (!task.outputsPresent()) {
                        completions.add(Completion.failed(task, attempt, new OutputValidationException(
                                "Batch job for task " + task.name() + " succeeded but outputs are missing"),
                                elapsedMs));
                    } else {
                        completions.add(Completion.succeeded(task, attempt, false, output, elapsedMs));
                    }
                } catch (RuntimeException e) {
                    completions.add(Completion.failed(task, attempt, e, elapsedMs));
                } finally {
                    MdcContext.clear();
                }
            }, workers);
        }

        private void onStateChange(Task task, TaskState state) {
            states.put(task.id(), state);
            log.debug("Task {} -> {}", task.name(), state);
            events.publish(PipelineEvent.task("task.state", runId, task.name(), Map.of("state", state.name())));
        }

        private void handle(Completion completion) {
            Task task = completion.task();
            if (completion.abandoned()) {
                markUnreachable(task, "run aborted");
                return;
            }
            if (completion.success()) {
                complete(completion);
                return;
            }

            Throwable error = completion.error();
            boolean retryable = !(error instanceof ConfigurationException)
                    && completion.attempt() < settings.maxAttempts()
                    && !aborted.get();
            if (retryable) {
                log.warn("Task {} failed on attempt {}/{}, retrying: {}",
                        task.name(), completion.attempt(), settings.maxAttempts(), error.getMessage());
                if (metrics != null) {
                    metrics.recordRetry(task.id().type());
                }
                events.publish(PipelineEvent.task("task.retrying", runId, task.name(),
                        Map.of("attempt", completion.attempt(), "error", String.valueOf(error.getMessage()))));
                dispatch(task);
                return;
            }
            fail(completion);
        }

        private void complete(Completion completion) {
            Task task = completion.task();
            states.put(task.id(), TaskState.COMPLETE);
            outcomes.put(task.id(), new TaskOutcome(task.name(), task.id().type(), TaskState.COMPLETE,
                    completion.skipped(), completion.attempt(), "", completion.output(), completion.elapsedMs()));
            if (completion.skipped()) {
                events.publish(PipelineEvent.task("task.skipped", runId, task.name(), Map.of()));
            } else {
                log.info("Task {} complete in {}ms", task.name(), completion.elapsedMs());
                events.publish(PipelineEvent.task("task.completed", runId, task.name(),
                        Map.of("elapsedMs", completion.elapsedMs())));
            }
            if (metrics != null) {
                metrics.recordTaskOutcome(task.id().type(), completion.skipped() ? "skipped" : "executed");
                if (!completion.skipped()) {
                    metrics.recordTaskDuration(task.id().type(), completion.elapsedMs());
                }
            }
            for (TaskId consumer : graph.consumersOf(task.id())) {
                int remaining = waitingOn.merge(consumer, -1, Integer::sum);
                if (remaining == 0 && states.get(consumer) == TaskState.PENDING && !outcomes.containsKey(consumer)) {
                    ready.add(graph.task(consumer));
                }
            }
        }

        private void fail(Completion completion) {
            Task task = completion.task();
            Throwable error = completion.error();
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            log.error("Task {} failed after {} attempt(s): {}", task.name(), completion.attempt(), message);
            states.put(task.id(), TaskState.FAILED);
            outcomes.put(task.id(), new TaskOutcome(task.name(), task.id().type(), TaskState.FAILED, false,
                    completion.attempt(), message, completion.output(), completion.elapsedMs()));
            events.publish(PipelineEvent.task("task.failed", runId, task.name(), Map.of("error", message)));
            if (metrics != null) {
                metrics.recordTaskOutcome(task.id().type(), "failed");
            }
            for (TaskId descendant : graph.descendantsOf(task.id())) {
                if (!outcomes.containsKey(descendant)) {
                    markUnreachable(graph.task(descendant), "upstream task " + task.name() + " failed");
                }
            }
        }

        private void markUnreachable(Task task, String reason) {
            states.put(task.id(), TaskState.UNREACHABLE);
            outcomes.put(task.id(), new TaskOutcome(task.name(), task.id().type(), TaskState.UNREACHABLE, false,
                    attempts.getOrDefault(task.id(), 0), reason, "", 0));
            log.warn("Task {} unreachable: {}", task.name(), reason);
            events.publish(PipelineEvent.task("task.unreachable", runId, task.name(), Map.of("reason", reason)));
            if (metrics != null) {
                metrics.recordTaskOutcome(task.id().type(), "unreachable");
            }
        }

        private void shutdownWorkers() {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Workers still busy after run {}, interrupting", runId);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String outputOf(Throwable error) {
        return error instanceof ContainerExecutionException cee ? cee.output() : "";
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "seqflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
