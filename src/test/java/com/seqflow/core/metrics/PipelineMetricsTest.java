package com.seqflow.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    @DisplayName("recordTaskDuration records by type tag")
    void recordTaskDuration() {
        metrics.recordTaskDuration("AssembleMetaSpades", 1200);
        metrics.recordTaskDuration("FastqpTask", 30);

        var timer = registry.find("seqflow.task.duration").tag("type", "AssembleMetaSpades").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordTaskOutcome counts by type and outcome")
    void recordTaskOutcome() {
        metrics.recordTaskOutcome("FamliTask", "executed");
        metrics.recordTaskOutcome("FamliTask", "executed");
        metrics.recordTaskOutcome("FamliTask", "skipped");

        var executed = registry.find("seqflow.task.outcomes")
                .tag("type", "FamliTask").tag("outcome", "executed").counter();
        var skipped = registry.find("seqflow.task.outcomes")
                .tag("type", "FamliTask").tag("outcome", "skipped").counter();
        assertEquals(2.0, executed.count());
        assertEquals(1.0, skipped.count());
    }

    @Test
    @DisplayName("recordRunResult increments by status tag")
    void recordRunResult() {
        metrics.recordRunResult(true);
        metrics.recordRunResult(false);
        metrics.recordRunResult(false);

        assertEquals(1.0, registry.find("seqflow.runs.total").tag("status", "succeeded").counter().count());
        assertEquals(2.0, registry.find("seqflow.runs.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("recordBatchPoll counts by phase")
    void recordBatchPoll() {
        metrics.recordBatchPoll("running");

        var counter = registry.find("seqflow.batch.polls").tag("phase", "running").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordInputMaterialization records to distribution summary")
    void recordInputMaterialization() {
        metrics.recordInputMaterialization(1024);
        metrics.recordInputMaterialization(2048);

        var summary = registry.find("seqflow.executor.materialized_bytes").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(3072.0, summary.totalAmount());
    }

    @Test
    @DisplayName("recordRetry counts by type")
    void recordRetry() {
        metrics.recordRetry("Humann2Task");

        assertEquals(1.0, registry.find("seqflow.task.retries").tag("type", "Humann2Task").counter().count());
    }
}
