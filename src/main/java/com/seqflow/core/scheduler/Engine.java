package com.seqflow.core.scheduler;

import com.seqflow.core.ConfigurationException;

import java.util.Locale;

/**
 * Where container tasks run.
 */
public enum Engine {
    /** Synchronously on the local Docker daemon, through the container executor. */
    DOCKER,
    /** Submitted to a batch backend and polled. */
    BATCH;

    public static Engine parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "docker" -> DOCKER;
            case "batch", "aws_batch" -> BATCH;
            default -> throw new ConfigurationException("Unknown engine '" + value + "' (expected docker or batch)");
        };
    }
}
