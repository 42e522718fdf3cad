package com.seqflow.batch;

import com.seqflow.core.SeqflowException;
import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.scheduler.RemoteExecutor;
import com.seqflow.core.scheduler.RetryPolicy;
import com.seqflow.core.scheduler.TransientBackendException;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetAccessException;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.Mount;
import com.seqflow.sandbox.ContainerExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs container tasks as jobs on a {@link BatchBackend}.
 *
 * <p>Submission happens on the calling thread and is retried with a
 * {@link RetryPolicy}. Status polling runs on a scheduled executor, so no
 * worker is held while a job is queued or running. Jobs read and write their
 * targets directly: placeholders render to target locations, local targets are
 * bind-mounted at their own path.
 */
public class BatchSubmitter implements RemoteExecutor, Closeable {

    private static final Logger log = LoggerFactory.getLogger(BatchSubmitter.class);

    private final BatchBackend backend;
    private final String queue;
    private final String jobRole;
    private final String scratchMount;
    private final Duration pollInterval;
    private final RetryPolicy submitRetry;
    private final int maxPollFailures;
    private final ScheduledExecutorService poller;
    private final boolean ownsPoller;
    private final PipelineMetrics metrics;
    private final Map<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public BatchSubmitter(BatchBackend backend, BatchProperties properties, String queue, String jobRole,
                          PipelineMetrics metrics) {
        this(backend, queue, jobRole, properties.getScratchMount(), properties.getPollInterval(),
                RetryPolicy.exponential(properties.getMaxRetries(), properties.getInitialBackoff()),
                properties.getMaxPollFailures(), null, metrics);
    }

    /**
     * @param poller scheduler used for status polls; when null a single-thread
     *               poller is created and shut down by {@link #close()}
     */
    public BatchSubmitter(BatchBackend backend, String queue, String jobRole, String scratchMount,
                          Duration pollInterval, RetryPolicy submitRetry, int maxPollFailures,
                          ScheduledExecutorService poller, PipelineMetrics metrics) {
        if (maxPollFailures < 1) {
            throw new IllegalArgumentException("maxPollFailures must be >= 1, got " + maxPollFailures);
        }
        this.backend = backend;
        this.queue = queue;
        this.jobRole = jobRole != null ? jobRole : "";
        this.scratchMount = scratchMount;
        this.pollInterval = pollInterval;
        this.submitRetry = submitRetry;
        this.maxPollFailures = maxPollFailures;
        this.ownsPoller = poller == null;
        this.poller = poller != null ? poller : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "seqflow-batch-poller");
            t.setDaemon(true);
            return t;
        });
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<String> submit(ContainerTask task, Map<String, List<Target>> inputs) {
        JobDescriptor descriptor = describe(task, inputs);
        log.debug("Job {} command: {}", descriptor.jobName(), String.join(" ", descriptor.command()));
        JobHandle handle = submitRetry.execute("Submitting job " + descriptor.jobName(),
                () -> backend.submit(descriptor));
        log.info("Task {} submitted to queue {} as job {}", task.name(), queue, handle.jobId());

        var job = new InFlight(task.name(), handle, new CompletableFuture<>());
        inFlight.put(handle.jobId(), job);
        schedulePoll(job);
        return job.future;
    }

    @Override
    public void cancelAll() {
        for (InFlight job : List.copyOf(inFlight.values())) {
            try {
                backend.cancel(job.handle);
                log.info("Cancelled job {} of task {}", job.handle.jobId(), job.taskName);
            } catch (RuntimeException e) {
                log.warn("Could not cancel job {} of task {}: {}", job.handle.jobId(), job.taskName, e.getMessage());
            }
            release(job);
            inFlight.remove(job.handle.jobId());
            job.future.completeExceptionally(new SeqflowException("Job " + job.handle.jobId() + " cancelled"));
        }
    }

    /** Number of jobs submitted and not yet finished. */
    public int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public void close() {
        if (ownsPoller) {
            poller.shutdownNow();
        }
    }

    /**
     * Builds the job for a task. Inputs and outputs render to their target
     * locations; {@code {scratch}} renders to the job's scratch mount.
     */
    JobDescriptor describe(ContainerTask task, Map<String, List<Target>> inputs) {
        var mounts = new LinkedHashSet<>(task.mounts());
        Map<String, List<String>> bindings = new LinkedHashMap<>();

        for (var entry : inputs.entrySet()) {
            var locations = new ArrayList<String>();
            for (Target target : entry.getValue()) {
                if (target.isLocal()) {
                    String path = target.localPath().orElseThrow().toString();
                    mounts.add(Mount.readOnly(path, path));
                    locations.add(path);
                } else {
                    locations.add(target.uri().toString());
                }
            }
            bindings.put(entry.getKey(), locations);
        }
        for (var entry : task.outputs().entrySet()) {
            Target target = entry.getValue();
            if (target.isLocal()) {
                Path path = target.localPath().orElseThrow();
                Path parent = path.toAbsolutePath().getParent();
                createDirectories(task, parent);
                mounts.add(Mount.readWrite(parent.toString(), parent.toString()));
                bindings.put(entry.getKey(), List.of(path.toString()));
            } else {
                bindings.put(entry.getKey(), List.of(target.uri().toString()));
            }
        }
        for (String name : task.parameters().names()) {
            bindings.putIfAbsent(name, List.of(task.parameters().render(name)));
        }
        bindings.put(ContainerTask.SCRATCH_PLACEHOLDER, List.of(scratchMount));

        return new JobDescriptor(task.jobName(), task.image(), task.command().render(bindings),
                task.resources().cpus(), task.resources().memoryMb(), queue, jobRole,
                new ArrayList<>(mounts), task.environment());
    }

    private void schedulePoll(InFlight job) {
        schedulePoll(job, pollInterval);
    }

    private void schedulePoll(InFlight job, Duration delay) {
        try {
            poller.schedule(() -> poll(job), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            finish(job, new SeqflowException("Polling stopped before job " + job.handle.jobId() + " finished", e));
        }
    }

    private void poll(InFlight job) {
        if (job.future.isDone()) {
            return;
        }
        JobStatus status;
        try {
            status = backend.poll(job.handle);
            job.pollFailures = 0;
        } catch (TransientBackendException e) {
            job.pollFailures++;
            if (job.pollFailures >= maxPollFailures) {
                finish(job, new TransientBackendException("Polling job " + job.handle.jobId() + " failed "
                        + job.pollFailures + " time(s) in a row: " + e.getMessage(), e));
                return;
            }
            Duration delay = pollInterval.plus(submitRetry.backoffAfter(job.pollFailures));
            log.warn("Polling job {} failed ({}/{}), next poll in {} ms: {}", job.handle.jobId(), job.pollFailures,
                    maxPollFailures, delay.toMillis(), e.getMessage());
            schedulePoll(job, delay);
            return;
        } catch (RuntimeException e) {
            finish(job, e);
            return;
        }

        if (metrics != null) {
            metrics.recordBatchPoll(status.phase().name().toLowerCase());
        }
        log.debug("Job {} of task {} is {}", job.handle.jobId(), job.taskName, status.phase());
        if (!status.phase().isTerminal()) {
            schedulePoll(job);
            return;
        }

        String logs = fetchLogs(job);
        release(job);
        if (status.phase() == JobStatus.Phase.SUCCEEDED) {
            inFlight.remove(job.handle.jobId());
            job.future.complete(logs);
        } else {
            String output = status.reason() != null ? logs + "\n" + status.reason() : logs;
            int exitCode = status.exitCode() != null ? status.exitCode() : -1;
            finish(job, new ContainerExecutionException(job.taskName, exitCode, output));
        }
    }

    private String fetchLogs(InFlight job) {
        try {
            return backend.logs(job.handle);
        } catch (RuntimeException e) {
            log.warn("Could not fetch logs of job {}: {}", job.handle.jobId(), e.getMessage());
            return "";
        }
    }

    private void release(InFlight job) {
        try {
            backend.release(job.handle);
        } catch (RuntimeException e) {
            log.warn("Could not release job {}: {}", job.handle.jobId(), e.getMessage());
        }
    }

    private void finish(InFlight job, Throwable error) {
        inFlight.remove(job.handle.jobId());
        job.future.completeExceptionally(error);
    }

    private static void createDirectories(ContainerTask task, Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TargetAccessException("Could not create output folder " + dir + " for task " + task.name(), e);
        }
    }

    private static final class InFlight {
        private final String taskName;
        private final JobHandle handle;
        private final CompletableFuture<String> future;
        private volatile int pollFailures;

        private InFlight(String taskName, JobHandle handle, CompletableFuture<String> future) {
            this.taskName = taskName;
            this.handle = handle;
            this.future = future;
        }
    }
}
