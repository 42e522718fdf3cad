package com.seqflow.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.seqflow.batch.BatchBackend;
import com.seqflow.batch.BatchProperties;
import com.seqflow.core.ConfigurationException;
import com.seqflow.core.events.EventBus;
import com.seqflow.core.events.PipelineEvent;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.scheduler.Engine;
import com.seqflow.core.scheduler.RunReport;
import com.seqflow.core.scheduler.SchedulerProperties;
import com.seqflow.sandbox.ContainerExecutor;
import com.seqflow.testing.TestTasks.Step;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.seqflow.testing.TestTasks.IN;
import static com.seqflow.testing.TestTasks.OUT;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PipelineEngineTest {

    @TempDir
    Path dir;

    private ContainerExecutor executor;
    private ObjectProvider<BatchBackend> backends;
    private SchedulerProperties schedulerProperties;
    private BatchProperties batchProperties;
    private SimpleMeterRegistry registry;
    private PipelineEngine engine;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        executor = mock(ContainerExecutor.class);
        backends = mock(ObjectProvider.class);
        schedulerProperties = new SchedulerProperties();
        batchProperties = new BatchProperties();
        registry = new SimpleMeterRegistry();
        engine = new PipelineEngine(executor, backends, batchProperties, schedulerProperties, new EventBus(),
                new PipelineMetrics(registry));
    }

    private TaskGraph chain() {
        Step a = Step.source("a", dir.resolve("a.txt"));
        Step b = Step.consuming("b", dir.resolve("b.txt"));
        return TaskGraph.builder().bind(b, IN, a, OUT).build();
    }

    @Test
    void defaultOptionsComeFromConfiguration() {
        schedulerProperties.setWorkers(12);
        schedulerProperties.setMaxAttempts(3);
        schedulerProperties.setEngine("batch");
        batchProperties.setQueue("spot");

        RunOptions options = engine.defaultOptions();

        assertEquals(Engine.BATCH, options.engine());
        assertEquals(12, options.workers());
        assertEquals(3, options.maxAttempts());
        assertEquals("spot", options.batchQueue());
        assertNull(options.reportFile());
    }

    @Test
    void runForwardsEventsAndWritesReport() throws Exception {
        Path reportFile = dir.resolve("reports/run.json");
        var events = new CopyOnWriteArrayList<PipelineEvent>();

        RunReport report = engine.run(chain(),
                new RunOptions(Engine.DOCKER, 2, 1, "optimal", "", null, reportFile), events::add);

        assertTrue(report.succeeded());
        assertFalse(events.isEmpty());
        assertTrue(events.stream().allMatch(e -> e.runId().equals(report.runId())));

        JsonNode json = new ObjectMapper().readTree(Files.readString(reportFile));
        assertTrue(json.get("succeeded").asBoolean());
        assertEquals(report.runId(), json.get("runId").asText());
        assertEquals("b", json.get("terminalTasks").get(0).asText());
        assertEquals(2, json.get("outcomes").size());
        json.get("outcomes").forEach(o -> assertEquals("COMPLETE", o.get("state").asText()));
        assertTrue(json.get("startedAt").isTextual());
        assertEquals(1.0, registry.get("seqflow.runs.total").tag("status", "succeeded").counter().count());
    }

    @Test
    void scratchRootOptionSwapsExecutor() {
        Path scratch = dir.resolve("scratch");
        when(executor.withScratchRoot(scratch)).thenReturn(mock(ContainerExecutor.class));

        engine.run(chain(), new RunOptions(Engine.DOCKER, 1, 1, "q", "", scratch, null), e -> { });

        verify(executor).withScratchRoot(scratch);
    }

    @Test
    void batchEngineWithoutBackendIsRejected() {
        when(backends.getIfAvailable()).thenReturn(null);

        assertThrows(ConfigurationException.class, () ->
                engine.run(chain(), new RunOptions(Engine.BATCH, 1, 1, "q", "", null, null), e -> { }));
    }

    @Test
    void nullEngineDefaultsToDocker() {
        assertEquals(Engine.DOCKER, new RunOptions(null, 1, 1, "q", null, null, null).engine());
        assertEquals("", new RunOptions(null, 1, 1, "q", null, null, null).jobRole());
    }
}
