package com.seqflow.batch;

import com.seqflow.core.SeqflowException;
import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.metrics.PipelineMetrics;
import com.seqflow.core.scheduler.RetryPolicy;
import com.seqflow.core.scheduler.TransientBackendException;
import com.seqflow.core.target.FileSystemObjectStore;
import com.seqflow.core.target.LocalTarget;
import com.seqflow.core.target.RemoteTarget;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetUri;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.Mount;
import com.seqflow.core.task.Parameters;
import com.seqflow.core.task.ResourceHints;
import com.seqflow.sandbox.ContainerExecutionException;
import com.seqflow.testing.TestTasks.Tool;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BatchSubmitterTest {

    @TempDir
    Path dir;

    private BatchBackend backend;
    private SimpleMeterRegistry registry;
    private BatchSubmitter submitter;
    private final JobHandle handle = new JobHandle("job-1", "tool", Instant.now());

    @BeforeEach
    void setUp() {
        backend = mock(BatchBackend.class);
        registry = new SimpleMeterRegistry();
        submitter = new BatchSubmitter(backend, "optimal", "role", "/scratch", Duration.ofMillis(5),
                new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO), 3, null, new PipelineMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        submitter.close();
    }

    @Test
    void describeRendersTargetLocations() throws Exception {
        Path input = Files.writeString(dir.resolve("S1.fastq.gz"), "reads");
        Path outDir = dir.resolve("results");
        Target remoteOut = new RemoteTarget(TargetUri.parse("s3://bucket/S1.json.gz"),
                new FileSystemObjectStore(dir.resolve("store")));
        Tool tool = new Tool("famli_S1", Parameters.builder().put("threads", 16).build(),
                List.of(InputSlot.one("in_fastq")),
                Map.of("out_tsv", new LocalTarget(outDir.resolve("S1.tsv")), "out_json", remoteOut),
                CommandTemplate.of("famli", "{in_fastq}", "{out_tsv}", "{out_json}", "{threads}", "{scratch}"),
                new ContainerSpec(new ResourceHints(16, 120000), List.of(Mount.readOnly("/refdbs", "/refdbs")), "famli"));

        JobDescriptor job = submitter.describe(tool, Map.of("in_fastq", List.of(new LocalTarget(input))));

        assertEquals("famli", job.jobName());
        assertEquals(List.of("famli", input.toString(), outDir.resolve("S1.tsv").toString(),
                "s3://bucket/S1.json.gz", "16", "/scratch"), job.command());
        assertEquals(16, job.cpus());
        assertEquals(120000, job.memoryMb());
        assertEquals("optimal", job.queue());
        assertEquals("role", job.jobRole());
        assertTrue(job.mounts().contains(Mount.readOnly("/refdbs", "/refdbs")));
        assertTrue(job.mounts().contains(Mount.readOnly(input.toString(), input.toString())));
        assertTrue(job.mounts().contains(Mount.readWrite(outDir.toString(), outDir.toString())));
        assertTrue(Files.isDirectory(outDir));
    }

    @Test
    void successfulJobCompletesWithLogs() throws Exception {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenReturn(JobStatus.running(), JobStatus.running(), JobStatus.succeeded());
        when(backend.logs(handle)).thenReturn("done");

        String logs = submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS);

        assertEquals("done", logs);
        verify(backend, times(3)).poll(handle);
        verify(backend).release(handle);
        assertEquals(0, submitter.inFlightCount());
        assertEquals(2.0, registry.get("seqflow.batch.polls").tag("phase", "running").counter().count());
    }

    @Test
    void failedJobCarriesExitCodeAndReason() {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenReturn(JobStatus.failed(3, "Essential container exited"));
        when(backend.logs(handle)).thenReturn("traceback");

        var e = assertThrows(ExecutionException.class, () -> submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS));

        var cause = assertInstanceOf(ContainerExecutionException.class, e.getCause());
        assertEquals(3, cause.exitCode());
        assertTrue(cause.output().contains("traceback"));
        assertTrue(cause.output().contains("Essential container exited"));
        verify(backend).release(handle);
    }

    @Test
    void transientSubmitFailuresAreRetried() throws Exception {
        when(backend.submit(any()))
                .thenThrow(new TransientBackendException("throttled"))
                .thenReturn(handle);
        when(backend.poll(handle)).thenReturn(JobStatus.succeeded());
        when(backend.logs(handle)).thenReturn("");

        submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS);

        verify(backend, times(2)).submit(any());
    }

    @Test
    void submitGivesUpAfterMaxAttempts() {
        when(backend.submit(any())).thenThrow(new TransientBackendException("throttled"));

        var e = assertThrows(TransientBackendException.class, () -> submitter.submit(tool(), Map.of()));
        assertTrue(e.getMessage().contains("after 3 attempt(s)"));
    }

    @Test
    void pollFailuresBelowLimitAreTolerated() throws Exception {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle))
                .thenThrow(new TransientBackendException("timeout"))
                .thenThrow(new TransientBackendException("timeout"))
                .thenReturn(JobStatus.succeeded());
        when(backend.logs(handle)).thenReturn("ok");

        assertEquals("ok", submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void consecutivePollFailuresFailTheJob() {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenThrow(new TransientBackendException("timeout"));

        var e = assertThrows(ExecutionException.class, () -> submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS));

        assertInstanceOf(TransientBackendException.class, e.getCause());
        verify(backend, times(3)).poll(handle);
    }

    @Test
    void pollFailuresBackOffBeforeTheNextPoll() {
        ScheduledExecutorService poller = mock(ScheduledExecutorService.class);
        var backingOff = new BatchSubmitter(backend, "optimal", "", "/scratch", Duration.ofMillis(5),
                new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(1)), 5, poller, null);
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenThrow(new TransientBackendException("timeout"));

        backingOff.submit(tool(), Map.of());
        ArgumentCaptor<Runnable> poll = ArgumentCaptor.forClass(Runnable.class);
        verify(poller).schedule(poll.capture(), eq(5L), eq(TimeUnit.MILLISECONDS));

        poll.getValue().run();
        verify(poller).schedule(any(Runnable.class), eq(105L), eq(TimeUnit.MILLISECONDS));
        poll.getValue().run();
        verify(poller).schedule(any(Runnable.class), eq(205L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void logFetchFailureDoesNotFailTheJob() throws Exception {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenReturn(JobStatus.succeeded());
        when(backend.logs(handle)).thenThrow(new TransientBackendException("log stream gone"));

        assertEquals("", submitter.submit(tool(), Map.of()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void cancelAllCancelsInFlightJobs() {
        when(backend.submit(any())).thenReturn(handle);
        when(backend.poll(handle)).thenReturn(JobStatus.running());

        CompletableFuture<String> future = submitter.submit(tool(), Map.of());
        submitter.cancelAll();

        verify(backend).cancel(handle);
        verify(backend).release(handle);
        var e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(SeqflowException.class, e.getCause());
        assertEquals(0, submitter.inFlightCount());
    }

    @Test
    void rejectsNonPositivePollFailureLimit() {
        assertThrows(IllegalArgumentException.class, () -> new BatchSubmitter(backend, "q", "", "/scratch",
                Duration.ofSeconds(1), RetryPolicy.none(), 0, null, null));
    }

    private Tool tool() {
        return new Tool("tool", List.of(), Map.of("out_file", new LocalTarget(dir.resolve("out.txt"))),
                CommandTemplate.of("tool", "{out_file}"));
    }
}
