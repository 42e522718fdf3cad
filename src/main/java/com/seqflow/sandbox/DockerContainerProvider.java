package com.seqflow.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.seqflow.core.SeqflowException;
import com.seqflow.core.task.Mount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based ContainerProvider.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>Bind mounts from the request, read-only or read-write</li>
 *   <li>Memory and CPU limits from the request</li>
 *   <li>The request's argument vector as the container command (no shell)</li>
 * </ul>
 * Missing images are pulled before the container is created.
 */
public class DockerContainerProvider implements ContainerProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerContainerProvider.class);

    private static final long NANO_CPUS_PER_CPU = 1_000_000_000L;

    private final DockerClient dockerClient;

    public DockerContainerProvider(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public String startContainer(ContainerRequest request) {
        ensureImage(request.image());

        log.info("Starting container {} (image: {}, cpus: {}, memory: {}MB)",
                request.name(), request.image(), request.cpus(), request.memoryMb());

        // Clean up any stale container with the same name from an interrupted run
        try {
            dockerClient.removeContainerCmd(request.name()).withForce(true).exec();
            log.debug("Removed stale container {}", request.name());
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", request.name());
        }

        var binds = new ArrayList<Bind>();
        for (Mount mount : request.mounts()) {
            binds.add(new Bind(mount.hostPath(), new Volume(mount.containerPath()),
                    mount.readOnly() ? AccessMode.ro : AccessMode.rw));
        }

        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds.toArray(new Bind[0]))
                .withMemory((long) request.memoryMb() * 1024 * 1024)
                .withNanoCPUs((long) request.cpus() * NANO_CPUS_PER_CPU);

        var envList = new ArrayList<String>();
        request.env().forEach((k, v) -> envList.add(k + "=" + v));

        var response = dockerClient.createContainerCmd(request.image())
                .withName(request.name())
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .withLabels(request.labels())
                .withCmd(request.command())
                .withWorkingDir(request.workingDir())
                .exec();

        String containerId = response.getId();
        dockerClient.startContainerCmd(containerId).exec();
        log.info("Container {} started ({})", request.name(), containerId);
        return containerId;
    }

    @Override
    public int waitForCompletion(String containerId, int timeoutSeconds) {
        try {
            var callback = dockerClient.waitContainerCmd(containerId)
                    .exec(new WaitContainerResultCallback());
            Integer result = timeoutSeconds > 0
                    ? callback.awaitStatusCode(timeoutSeconds, TimeUnit.SECONDS)
                    : callback.awaitStatusCode();
            return result != null ? result : -1;
        } catch (Exception e) {
            log.error("Timeout or error waiting for container {}", containerId, e);
            return -1;
        }
    }

    @Override
    public String captureOutput(String containerId) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from container {}", containerId);
        }
        return sb.toString();
    }

    @Override
    public ContainerStatus inspect(String containerId) {
        InspectContainerResponse.ContainerState state = dockerClient.inspectContainerCmd(containerId)
                .exec()
                .getState();
        boolean running = Boolean.TRUE.equals(state.getRunning());
        Long exitCode = state.getExitCodeLong();
        Integer code = running || exitCode == null ? null : exitCode.intValue();
        String error = state.getError() != null && !state.getError().isBlank() ? state.getError() : null;
        return new ContainerStatus(running, code, error);
    }

    @Override
    public void stopContainer(String containerId) {
        try {
            dockerClient.stopContainerCmd(containerId).exec();
            log.info("Container {} stopped", containerId);
        } catch (NotModifiedException | NotFoundException e) {
            log.debug("Container {} may already be stopped: {}", containerId, e.getMessage());
        }
    }

    @Override
    public void removeContainer(String containerId) {
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.debug("Container {} removed", containerId);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            log.info("Image {} not found locally, pulling", image);
        }
        try {
            dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SeqflowException("Interrupted while pulling image " + image, e);
        }
        log.info("Pulled image {}", image);
    }
}
