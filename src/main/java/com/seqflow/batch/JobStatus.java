package com.seqflow.batch;

/**
 * Status reported by a batch backend.
 *
 * @param phase    lifecycle phase
 * @param exitCode container exit code once finished, otherwise null
 * @param reason   backend-provided explanation, may be null
 */
public record JobStatus(Phase phase, Integer exitCode, String reason) {

    public enum Phase {
        SUBMITTED,
        RUNNING,
        SUCCEEDED,
        FAILED;

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    public static JobStatus running() {
        return new JobStatus(Phase.RUNNING, null, null);
    }

    public static JobStatus succeeded() {
        return new JobStatus(Phase.SUCCEEDED, 0, null);
    }

    public static JobStatus failed(Integer exitCode, String reason) {
        return new JobStatus(Phase.FAILED, exitCode, reason);
    }
}
