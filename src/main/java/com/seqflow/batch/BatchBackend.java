package com.seqflow.batch;

import com.seqflow.core.scheduler.TransientBackendException;

/**
 * Remote batch compute service.
 * Implementation: DockerBatchBackend (jobs as detached containers on a Docker host).
 *
 * <p>Every method may throw {@link TransientBackendException} for failures that
 * are worth retrying.
 */
public interface BatchBackend {

    JobHandle submit(JobDescriptor job);

    JobStatus poll(JobHandle handle);

    /** Combined output of a finished job. */
    String logs(JobHandle handle);

    void cancel(JobHandle handle);

    /** Frees backend resources held by a finished job. */
    void release(JobHandle handle);
}
