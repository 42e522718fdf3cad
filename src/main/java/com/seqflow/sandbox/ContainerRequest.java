package com.seqflow.sandbox;

import com.seqflow.core.task.Mount;

import java.util.List;
import java.util.Map;

/**
 * Everything a {@link ContainerProvider} needs to start one container.
 *
 * @param name       container name, unique per invocation
 * @param image      image reference
 * @param command    argument vector, passed without a shell
 * @param mounts     host paths exposed in the container
 * @param env        environment variables
 * @param cpus       CPU limit
 * @param memoryMb   memory ceiling in MB
 * @param workingDir working directory inside the container
 * @param labels     container labels
 */
public record ContainerRequest(
    String name,
    String image,
    List<String> command,
    List<Mount> mounts,
    Map<String, String> env,
    int cpus,
    int memoryMb,
    String workingDir,
    Map<String, String> labels
) {
    public ContainerRequest {
        command = List.copyOf(command);
        mounts = List.copyOf(mounts);
        env = Map.copyOf(env);
        labels = Map.copyOf(labels);
    }
}
