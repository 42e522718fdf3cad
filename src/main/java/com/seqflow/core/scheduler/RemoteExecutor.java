package com.seqflow.core.scheduler;

import com.seqflow.core.target.Target;
import com.seqflow.core.task.ContainerTask;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs container tasks on a remote backend.
 *
 * <p>{@link #submit} blocks only while the job is submitted; the returned future
 * completes when the backend reports a terminal status.
 */
public interface RemoteExecutor {

    /**
     * @return future of the job's captured output, completed exceptionally when the job fails
     */
    CompletableFuture<String> submit(ContainerTask task, Map<String, List<Target>> inputs);

    /** Best-effort cancellation of every job still in flight. */
    void cancelAll();
}
