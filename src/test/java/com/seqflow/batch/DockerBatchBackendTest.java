package com.seqflow.batch;

import com.seqflow.core.scheduler.TransientBackendException;
import com.seqflow.core.task.Mount;
import com.seqflow.sandbox.ContainerProvider;
import com.seqflow.sandbox.ContainerRequest;
import com.seqflow.sandbox.ContainerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DockerBatchBackendTest {

    private ContainerProvider provider;
    private DockerBatchBackend backend;
    private final JobHandle handle = new JobHandle("container-1", "metaspades_S1", Instant.now());

    @BeforeEach
    void setUp() {
        provider = mock(ContainerProvider.class);
        backend = new DockerBatchBackend(provider);
    }

    @Test
    void submitStartsLabelledContainer() {
        when(provider.startContainer(any())).thenReturn("container-1");
        var job = new JobDescriptor("metaspades_S1", "img:1", List.of("run_metaspades.py", "--threads", "4"),
                4, 10000, "optimal", "arn:role/batch", List.of(Mount.readOnly("/data", "/data")), Map.of());

        JobHandle submitted = backend.submit(job);

        assertEquals("container-1", submitted.jobId());
        assertEquals("metaspades_S1", submitted.jobName());
        var captor = ArgumentCaptor.forClass(ContainerRequest.class);
        verify(provider).startContainer(captor.capture());
        ContainerRequest request = captor.getValue();
        assertTrue(request.name().startsWith("metaspades_S1-"));
        assertEquals(List.of("run_metaspades.py", "--threads", "4"), request.command());
        assertEquals(4, request.cpus());
        assertEquals(10000, request.memoryMb());
        assertEquals("optimal", request.labels().get("seqflow.queue"));
        assertEquals("arn:role/batch", request.labels().get("seqflow.role"));
    }

    @Test
    void blankRoleIsNotLabelled() {
        when(provider.startContainer(any())).thenReturn("c");
        backend.submit(new JobDescriptor("j", "img", List.of("true"), 1, 1024, "q", "", List.of(), Map.of()));

        var captor = ArgumentCaptor.forClass(ContainerRequest.class);
        verify(provider).startContainer(captor.capture());
        assertFalse(captor.getValue().labels().containsKey("seqflow.role"));
    }

    @Test
    void pollMapsContainerState() {
        when(provider.inspect("container-1"))
                .thenReturn(new ContainerStatus(true, null, null))
                .thenReturn(new ContainerStatus(false, 0, null))
                .thenReturn(new ContainerStatus(false, 137, "OOMKilled"));

        assertEquals(JobStatus.Phase.RUNNING, backend.poll(handle).phase());
        assertEquals(JobStatus.Phase.SUCCEEDED, backend.poll(handle).phase());
        JobStatus failed = backend.poll(handle);
        assertEquals(JobStatus.Phase.FAILED, failed.phase());
        assertEquals(137, failed.exitCode());
        assertEquals("OOMKilled", failed.reason());
    }

    @Test
    void providerErrorsBecomeTransient() {
        when(provider.inspect("container-1")).thenThrow(new RuntimeException("connection reset"));

        var e = assertThrows(TransientBackendException.class, () -> backend.poll(handle));
        assertTrue(e.getMessage().contains("connection reset"));
    }

    @Test
    void cancelStopsAndReleaseRemoves() {
        backend.cancel(handle);
        backend.release(handle);

        verify(provider).stopContainer("container-1");
        verify(provider).removeContainer("container-1");
    }

    @Test
    void jobNameIsRestricted() {
        assertThrows(IllegalArgumentException.class, () ->
                new JobDescriptor("bad name!", "img", List.of("true"), 1, 1024, "q", "", List.of(), Map.of()));
    }
}
