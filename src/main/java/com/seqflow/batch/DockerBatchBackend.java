package com.seqflow.batch;

import com.seqflow.core.scheduler.TransientBackendException;
import com.seqflow.sandbox.ContainerProvider;
import com.seqflow.sandbox.ContainerRequest;
import com.seqflow.sandbox.ContainerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Batch backend running each job as a detached container on a Docker host.
 * Queue and role are attached as container labels.
 */
public class DockerBatchBackend implements BatchBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerBatchBackend.class);

    private final ContainerProvider provider;

    public DockerBatchBackend(ContainerProvider provider) {
        this.provider = provider;
    }

    @Override
    public JobHandle submit(JobDescriptor job) {
        String containerName = job.jobName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        var labels = new LinkedHashMap<String, String>();
        labels.put("seqflow.job", job.jobName());
        labels.put("seqflow.queue", job.queue());
        if (!job.jobRole().isBlank()) {
            labels.put("seqflow.role", job.jobRole());
        }
        var request = new ContainerRequest(containerName, job.image(), job.command(), job.mounts(),
                job.env(), job.cpus(), job.memoryMb(), "/", labels);
        String containerId = call("submit " + job.jobName(), () -> provider.startContainer(request));
        log.info("Submitted job {} to queue {} as container {}", job.jobName(), job.queue(), containerId);
        return new JobHandle(containerId, job.jobName(), Instant.now());
    }

    @Override
    public JobStatus poll(JobHandle handle) {
        ContainerStatus status = call("poll " + handle.jobName(), () -> provider.inspect(handle.jobId()));
        if (status.running()) {
            return JobStatus.running();
        }
        Integer exitCode = status.exitCode();
        if (exitCode != null && exitCode == 0) {
            return JobStatus.succeeded();
        }
        return JobStatus.failed(exitCode, status.error());
    }

    @Override
    public String logs(JobHandle handle) {
        return call("fetch logs of " + handle.jobName(), () -> provider.captureOutput(handle.jobId()));
    }

    @Override
    public void cancel(JobHandle handle) {
        call("cancel " + handle.jobName(), () -> {
            provider.stopContainer(handle.jobId());
            return null;
        });
    }

    @Override
    public void release(JobHandle handle) {
        provider.removeContainer(handle.jobId());
    }

    private static <T> T call(String description, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw new TransientBackendException("Docker backend could not " + description + ": " + e.getMessage(), e);
        }
    }
}
