package com.seqflow.core.task;

/**
 * Host path exposed inside a container.
 */
public record Mount(String hostPath, String containerPath, boolean readOnly) {

    public static Mount readWrite(String hostPath, String containerPath) {
        return new Mount(hostPath, containerPath, false);
    }

    public static Mount readOnly(String hostPath, String containerPath) {
        return new Mount(hostPath, containerPath, true);
    }
}
