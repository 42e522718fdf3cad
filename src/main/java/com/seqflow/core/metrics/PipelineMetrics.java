package com.seqflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskDuration(String taskType, long ms) {
        Timer.builder("seqflow.task.duration")
                .tag("type", taskType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "executed", "skipped", "failed" or "unreachable"
     */
    public void recordTaskOutcome(String taskType, String outcome) {
        Counter.builder("seqflow.task.outcomes")
                .tag("type", taskType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRetry(String taskType) {
        Counter.builder("seqflow.task.retries")
                .description("Task attempts started after a failure")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordBatchPoll(String phase) {
        Counter.builder("seqflow.batch.polls")
                .description("Batch job status polls by reported phase")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordInputMaterialization(long bytes) {
        DistributionSummary.builder("seqflow.executor.materialized_bytes")
                .description("Bytes downloaded into scratch space per remote input")
                .baseUnit("bytes")
                .register(registry)
                .record(bytes);
    }

    public void recordRunResult(boolean succeeded) {
        Counter.builder("seqflow.runs.total")
                .tag("status", succeeded ? "succeeded" : "failed")
                .register(registry)
                .increment();
    }
}
