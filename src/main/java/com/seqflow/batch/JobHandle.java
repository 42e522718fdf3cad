package com.seqflow.batch;

import java.time.Instant;

/**
 * Backend reference to a submitted job.
 */
public record JobHandle(String jobId, String jobName, Instant submittedAt) {
}
