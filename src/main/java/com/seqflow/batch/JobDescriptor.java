package com.seqflow.batch;

import com.seqflow.core.task.Mount;

import java.util.List;
import java.util.Map;

/**
 * A container job as submitted to a batch backend.
 *
 * @param jobName  job name, restricted to {@code [A-Za-z0-9_-]}
 * @param image    image reference
 * @param command  argument vector
 * @param cpus     vCPUs requested
 * @param memoryMb memory requested in MB
 * @param queue    backend queue identifier
 * @param jobRole  execution role or credential identifier, may be blank
 * @param mounts   host volumes exposed to the job
 * @param env      environment variables
 */
public record JobDescriptor(
    String jobName,
    String image,
    List<String> command,
    int cpus,
    int memoryMb,
    String queue,
    String jobRole,
    List<Mount> mounts,
    Map<String, String> env
) {
    public JobDescriptor {
        if (jobName == null || !jobName.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Invalid job name: " + jobName);
        }
        command = List.copyOf(command);
        mounts = List.copyOf(mounts);
        env = Map.copyOf(env);
        jobRole = jobRole != null ? jobRole : "";
    }
}
