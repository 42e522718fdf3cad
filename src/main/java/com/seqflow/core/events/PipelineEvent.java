package com.seqflow.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes, consumed by the CLI for live progress.
 *
 * @param eventType event type (e.g. "run.started", "task.completed", "task.unreachable")
 * @param runId     the run this event belongs to
 * @param taskName  the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String runId,
    String taskName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent run(String eventType, String runId, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, null, payload, Instant.now());
    }

    public static PipelineEvent task(String eventType, String runId, String taskName, Map<String, Object> payload) {
        return new PipelineEvent(eventType, runId, taskName, payload, Instant.now());
    }
}
