package com.seqflow.sandbox;

/**
 * Abstraction for container orchestration.
 * Implementation: DockerContainerProvider.
 */
public interface ContainerProvider {

    /**
     * Creates and starts a container.
     * @return the container ID
     */
    String startContainer(ContainerRequest request);

    /**
     * Blocks until the container exits or the timeout is reached.
     * @param timeoutSeconds zero or less waits without limit
     * @return the container exit code (0 = success), -1 on timeout or error
     */
    int waitForCompletion(String containerId, int timeoutSeconds);

    /**
     * Captures stdout/stderr logs from the container.
     */
    String captureOutput(String containerId);

    /**
     * Non-blocking status query.
     */
    ContainerStatus inspect(String containerId);

    void stopContainer(String containerId);

    /**
     * Stops the container if needed and removes it.
     */
    void removeContainer(String containerId);
}
