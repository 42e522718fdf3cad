package com.seqflow.core.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.seqflow.core.task.TaskState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-task results of a run. The run succeeded iff every terminal task is COMPLETE.
 */
public record RunReport(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    List<String> terminalTasks,
    List<TaskOutcome> outcomes
) {

    public RunReport {
        terminalTasks = List.copyOf(terminalTasks);
        outcomes = List.copyOf(outcomes);
    }

    @JsonProperty("succeeded")
    public boolean succeeded() {
        for (String name : terminalTasks) {
            if (outcome(name).map(o -> o.state() != TaskState.COMPLETE).orElse(true)) {
                return false;
            }
        }
        return true;
    }

    public Optional<TaskOutcome> outcome(String taskName) {
        return outcomes.stream().filter(o -> o.name().equals(taskName)).findFirst();
    }

    public List<TaskOutcome> failed() {
        return withState(TaskState.FAILED);
    }

    public List<TaskOutcome> unreachable() {
        return withState(TaskState.UNREACHABLE);
    }

    public long executedCount() {
        return outcomes.stream().filter(o -> o.state() == TaskState.COMPLETE && !o.skipped()).count();
    }

    public long skippedCount() {
        return outcomes.stream().filter(o -> o.state() == TaskState.COMPLETE && o.skipped()).count();
    }

    private List<TaskOutcome> withState(TaskState state) {
        return outcomes.stream().filter(o -> o.state() == state).toList();
    }
}
