package com.seqflow.core.scheduler;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.task.TaskState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunReportTest {

    private static TaskOutcome outcome(String name, TaskState state, boolean skipped) {
        return new TaskOutcome(name, "Step", state, skipped, 1, "", "", 10);
    }

    @Test
    void succeedsWhenEveryTerminalTaskIsComplete() {
        var report = new RunReport("r1", Instant.now(), Instant.now(), List.of("join"), List.of(
                outcome("a", TaskState.COMPLETE, true),
                outcome("join", TaskState.COMPLETE, false)));

        assertTrue(report.succeeded());
        assertEquals(1, report.executedCount());
        assertEquals(1, report.skippedCount());
    }

    @Test
    void failsWhenATerminalTaskIsNotComplete() {
        var report = new RunReport("r1", Instant.now(), Instant.now(), List.of("x", "y"), List.of(
                outcome("bad", TaskState.FAILED, false),
                outcome("x", TaskState.UNREACHABLE, false),
                outcome("y", TaskState.COMPLETE, false)));

        assertFalse(report.succeeded());
        assertEquals(List.of("bad"), report.failed().stream().map(TaskOutcome::name).toList());
        assertEquals(List.of("x"), report.unreachable().stream().map(TaskOutcome::name).toList());
    }

    @Test
    void missingTerminalOutcomeCountsAsFailure() {
        var report = new RunReport("r1", Instant.now(), Instant.now(), List.of("ghost"), List.of());

        assertFalse(report.succeeded());
        assertTrue(report.outcome("ghost").isEmpty());
    }

    @Test
    void engineNamesParseCaseInsensitively() {
        assertEquals(Engine.DOCKER, Engine.parse(" Docker "));
        assertEquals(Engine.BATCH, Engine.parse("aws_batch"));
        assertThrows(ConfigurationException.class, () -> Engine.parse("kubernetes"));
    }

    @Test
    void settingsRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulerSettings(0, 1, Engine.DOCKER));
        assertThrows(IllegalArgumentException.class, () -> new SchedulerSettings(1, 0, Engine.DOCKER));
        assertEquals(Engine.DOCKER, new SchedulerSettings(1, 1, null).engine());
    }
}
