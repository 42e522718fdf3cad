package com.seqflow.sandbox;

/**
 * Point-in-time state of a container.
 *
 * @param running  whether the container is still running
 * @param exitCode exit code once stopped, {@code null} while running
 * @param error    runtime error reported by the engine, if any
 */
public record ContainerStatus(boolean running, Integer exitCode, String error) {
}
