package com.seqflow.core.task;

import java.util.List;

/**
 * Execution settings of a container task that are not part of its identity.
 *
 * @param resources CPU and memory hints
 * @param mounts    extra mounts added to the container
 * @param jobPrefix batch job name prefix; the task name is used when blank
 */
public record ContainerSpec(ResourceHints resources, List<Mount> mounts, String jobPrefix) {

    public ContainerSpec {
        resources = resources != null ? resources : ResourceHints.DEFAULT;
        mounts = mounts != null ? List.copyOf(mounts) : List.of();
        jobPrefix = jobPrefix != null ? jobPrefix : "";
    }

    public static ContainerSpec of(ResourceHints resources) {
        return new ContainerSpec(resources, List.of(), "");
    }
}
