package com.seqflow.pipelines;

import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.Mount;
import com.seqflow.core.task.ResourceHints;

import java.util.ArrayList;
import java.util.List;

/**
 * Container settings shared by every pipeline step: the host scratch volume
 * mounted read-write, plus step-specific extras.
 */
public class ContainerDefaults {

    private final PipelineProperties properties;

    public ContainerDefaults(PipelineProperties properties) {
        this.properties = properties;
    }

    public ContainerSpec spec(String jobPrefix, int cpus, int memoryMb) {
        return new ContainerSpec(new ResourceHints(cpus, memoryMb), List.of(scratchMount()), jobPrefix);
    }

    /** Like {@link #spec} with the reference database volume mounted read-only. */
    public ContainerSpec specWithRefdbs(String jobPrefix, int cpus, int memoryMb) {
        var mounts = new ArrayList<Mount>();
        mounts.add(scratchMount());
        mounts.add(Mount.readOnly(properties.getRefdbs(), properties.getRefdbs()));
        return new ContainerSpec(new ResourceHints(cpus, memoryMb), mounts, jobPrefix);
    }

    public PipelineProperties.Images images() {
        return properties.getImages();
    }

    private Mount scratchMount() {
        return Mount.readWrite(properties.getSharedScratch(), properties.getContainerScratch());
    }
}
