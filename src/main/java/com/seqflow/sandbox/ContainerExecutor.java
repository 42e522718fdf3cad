package com.seqflow.sandbox;

import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetAccessException;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.Mount;
import com.seqflow.core.task.OutputValidationException;
import com.seqflow.core.task.TaskState;
import com.seqflow.core.task.TaskStateListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a {@link ContainerTask} inside a container with controlled filesystem visibility.
 *
 * <p>Flow: create scratch space -> resolve inputs (bind local files read-only,
 * download remote ones) -> allocate outputs -> render command -> run container ->
 * capture output -> verify and publish outputs -> delete scratch space.
 *
 * <p>Inside the container the scratch space is mounted at the sandbox root:
 * <ul>
 *   <li>{@code <sandbox>/inputs/<slot>/<n>-<file>} for each bound input</li>
 *   <li>{@code <sandbox>/outputs/<slot>/<file>} for each declared output</li>
 *   <li>{@code <sandbox>/work}, also the working directory and the {@code {scratch}} placeholder</li>
 * </ul>
 */
@Service
public class ContainerExecutor {

    private static final Logger log = LoggerFactory.getLogger(ContainerExecutor.class);

    private final ContainerProvider provider;
    private final Path scratchRoot;
    private final String sandboxRoot;
    private final int timeoutSeconds;
    private final boolean keepFailedScratch;
    private final PipelineMetrics metrics;

    @Autowired
    public ContainerExecutor(ContainerProvider provider, SandboxProperties properties,
                             @Autowired(required = false) PipelineMetrics metrics) {
        this(provider, Path.of(properties.getScratchRoot()), properties.getSandboxRoot(),
                properties.getTimeoutSeconds(), properties.isKeepFailedScratch(), metrics);
    }

    public ContainerExecutor(ContainerProvider provider, Path scratchRoot, String sandboxRoot,
                             int timeoutSeconds, boolean keepFailedScratch, PipelineMetrics metrics) {
        this.provider = provider;
        this.scratchRoot = scratchRoot;
        this.sandboxRoot = trimTrailingSlash(sandboxRoot);
        this.timeoutSeconds = timeoutSeconds;
        this.keepFailedScratch = keepFailedScratch;
        this.metrics = metrics;
    }

    /**
     * Copy of this executor using another scratch root.
     */
    public ContainerExecutor withScratchRoot(Path root) {
        return new ContainerExecutor(provider, root, sandboxRoot, timeoutSeconds, keepFailedScratch, metrics);
    }

    public Path scratchRoot() {
        return scratchRoot;
    }

    /**
     * Result of executing a task inside a container.
     *
     * @param exitCode     container exit code (0 = success)
     * @param output       captured stdout/stderr from the container
     * @param containerId  the container ID that ran this task
     * @param published    output targets that were published
     * @param downloads    number of remote inputs materialized into scratch space
     * @param elapsedMs    wall-clock time in milliseconds
     */
    public record ExecutionResult(
        int exitCode,
        String output,
        String containerId,
        Map<String, Target> published,
        int downloads,
        long elapsedMs
    ) {}

    /**
     * Executes a task.
     *
     * @param task     the task to run
     * @param inputs   resolved input targets by slot, as produced by the task graph
     * @param listener receives RESOLVING_INPUTS, RUNNING and PUBLISHING transitions
     * @throws ContainerExecutionException on a non-zero exit
     * @throws OutputValidationException   when an output is missing or empty
     * @throws TargetAccessException       when an input cannot be read or an output cannot be published
     */
    public ExecutionResult execute(ContainerTask task, Map<String, List<Target>> inputs,
                                   TaskStateListener listener) {
        long startMs = System.currentTimeMillis();
        ScratchSpace scratch = createScratch(task);
        try {
            listener.onStateChange(task, TaskState.RESOLVING_INPUTS);
            var mounts = new ArrayList<Mount>();
            mounts.add(Mount.readWrite(scratch.root().toString(), sandboxRoot));
            Map<String, List<String>> bindings = new LinkedHashMap<>();

            int downloads = resolveInputs(task, inputs, scratch, mounts, bindings);
            Map<String, Path> localOutputs = allocateOutputs(task, scratch, bindings);
            for (String name : task.parameters().names()) {
                bindings.putIfAbsent(name, List.of(task.parameters().render(name)));
            }
            bindings.put(ContainerTask.SCRATCH_PLACEHOLDER, List.of(sandboxPath(ScratchSpace.WORK)));
            List<String> argv = task.command().render(bindings);
            mounts.addAll(task.mounts());

            listener.onStateChange(task, TaskState.RUNNING);
            var request = new ContainerRequest(
                    "seqflow-" + scratch.id(),
                    task.image(),
                    argv,
                    mounts,
                    task.environment(),
                    task.resources().cpus(),
                    task.resources().memoryMb(),
                    sandboxPath(ScratchSpace.WORK),
                    Map.of("seqflow.task", task.name(), "seqflow.type", task.id().type())
            );
            String containerId = provider.startContainer(request);

            int exitCode;
            String output;
            try {
                exitCode = provider.waitForCompletion(containerId, timeoutSeconds);
                output = provider.captureOutput(containerId);
            } finally {
                provider.removeContainer(containerId);
            }
            long elapsedMs = System.currentTimeMillis() - startMs;
            log.info("Container {} for task {} exited with code {} in {}ms",
                    containerId, task.name(), exitCode, elapsedMs);

            if (exitCode != 0) {
                throw new ContainerExecutionException(task.name(), exitCode, output);
            }

            listener.onStateChange(task, TaskState.PUBLISHING);
            verifyOutputs(task, localOutputs);
            Map<String, Target> published = publish(task, localOutputs);
            return new ExecutionResult(exitCode, output, containerId, published, downloads,
                    System.currentTimeMillis() - startMs);
        } catch (RuntimeException e) {
            if (keepFailedScratch) {
                scratch.retain();
            }
            throw e;
        } finally {
            scratch.close();
        }
    }

    private ScratchSpace createScratch(ContainerTask task) {
        try {
            return ScratchSpace.create(scratchRoot, task.name());
        } catch (IOException e) {
            throw new TargetAccessException("Could not create scratch space under " + scratchRoot, e);
        }
    }

    private int resolveInputs(ContainerTask task, Map<String, List<Target>> inputs, ScratchSpace scratch,
                              List<Mount> mounts, Map<String, List<String>> bindings) {
        int downloads = 0;
        for (var entry : inputs.entrySet()) {
            String slot = entry.getKey();
            var paths = new ArrayList<String>();
            List<Target> targets = entry.getValue();
            for (int i = 0; i < targets.size(); i++) {
                Target target = targets.get(i);
                String relative = ScratchSpace.INPUTS + "/" + slot + "/" + i + "-" + target.uri().fileName();
                String containerPath = sandboxPath(relative);
                Path local = scratch.root().resolve(relative);
                try {
                    Files.createDirectories(local.getParent());
                    if (target.isLocal()) {
                        Path source = target.localPath().orElseThrow();
                        if (!Files.isRegularFile(source)) {
                            throw new TargetAccessException("Input '" + slot + "' of task " + task.name()
                                    + " does not exist: " + source);
                        }
                        mounts.add(Mount.readOnly(source.toString(), containerPath));
                        log.debug("Input {}[{}] of {} bound from {}", slot, i, task.name(), source);
                    } else {
                        target.materializeTo(local);
                        downloads++;
                        if (metrics != null) {
                            metrics.recordInputMaterialization(Files.size(local));
                        }
                        log.debug("Input {}[{}] of {} downloaded from {}", slot, i, task.name(), target);
                    }
                } catch (IOException e) {
                    throw new TargetAccessException("Could not materialize input '" + slot + "' of task "
                            + task.name() + " from " + target, e);
                }
                paths.add(containerPath);
            }
            bindings.put(slot, paths);
        }
        return downloads;
    }

    private Map<String, Path> allocateOutputs(ContainerTask task, ScratchSpace scratch,
                                              Map<String, List<String>> bindings) {
        Map<String, Path> localOutputs = new LinkedHashMap<>();
        for (var entry : task.outputs().entrySet()) {
            String slot = entry.getKey();
            String relative = ScratchSpace.OUTPUTS + "/" + slot + "/" + entry.getValue().uri().fileName();
            Path local = scratch.root().resolve(relative);
            try {
                Files.createDirectories(local.getParent());
            } catch (IOException e) {
                throw new TargetAccessException("Could not allocate output '" + slot + "' of task " + task.name(), e);
            }
            localOutputs.put(slot, local);
            bindings.put(slot, List.of(sandboxPath(relative)));
        }
        return localOutputs;
    }

    private void verifyOutputs(ContainerTask task, Map<String, Path> localOutputs) {
        for (var entry : localOutputs.entrySet()) {
            Path local = entry.getValue();
            try {
                if (!Files.isRegularFile(local) || Files.size(local) == 0) {
                    throw new OutputValidationException("Task " + task.name() + " did not produce output '"
                            + entry.getKey() + "' (missing or empty: " + local.getFileName() + ")");
                }
            } catch (IOException e) {
                throw new TargetAccessException("Could not inspect output '" + entry.getKey()
                        + "' of task " + task.name(), e);
            }
        }
    }

    /**
     * Publishes every output; on failure, deletes the ones already published.
     */
    private Map<String, Target> publish(ContainerTask task, Map<String, Path> localOutputs) {
        Map<String, Target> outputs = task.outputs();
        Map<String, Target> published = new LinkedHashMap<>();
        for (var entry : localOutputs.entrySet()) {
            Target target = outputs.get(entry.getKey());
            try {
                target.publishFrom(entry.getValue());
                published.put(entry.getKey(), target);
                log.debug("Published output {} of {} to {}", entry.getKey(), task.name(), target);
            } catch (IOException | RuntimeException e) {
                rollback(task, published);
                throw new TargetAccessException("Could not publish output '" + entry.getKey()
                        + "' of task " + task.name() + " to " + target, e);
            }
        }
        return published;
    }

    private void rollback(ContainerTask task, Map<String, Target> published) {
        for (var entry : published.entrySet()) {
            try {
                entry.getValue().delete();
                log.info("Removed partially published output {} of {}", entry.getKey(), task.name());
            } catch (IOException | RuntimeException e) {
                log.warn("Could not remove partially published output {} of {}: {}",
                        entry.getValue(), task.name(), e.getMessage());
            }
        }
    }

    private String sandboxPath(String relative) {
        return sandboxRoot + "/" + relative;
    }

    private static String trimTrailingSlash(String path) {
        String normalized = PathNormalizer.folder(path);
        return normalized.length() > 1 ? normalized.substring(0, normalized.length() - 1) : "";
    }
}
