package com.seqflow.core.task;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.PathNormalizer;

import java.util.List;
import java.util.Map;

/**
 * Task whose work is a command run inside a container image.
 *
 * <p>Command placeholders may name input slots, output slots, parameters and
 * the reserved {@code scratch} directory.
 */
public abstract class ContainerTask extends AbstractTask {

    public static final String SCRATCH_PLACEHOLDER = "scratch";

    private final ContainerSpec spec;

    protected ContainerTask(String name, Parameters parameters, ContainerSpec spec) {
        super(name, parameters);
        this.spec = spec != null ? spec : ContainerSpec.of(ResourceHints.DEFAULT);
    }

    @Override
    public TaskKind kind() {
        return TaskKind.CONTAINER;
    }

    public abstract String image();

    public abstract CommandTemplate command();

    public ResourceHints resources() {
        return spec.resources();
    }

    public List<Mount> mounts() {
        return spec.mounts();
    }

    public Map<String, String> environment() {
        return Map.of();
    }

    /**
     * Batch job name, restricted to {@code [A-Za-z0-9_-]}.
     */
    public String jobName() {
        String prefix = spec.jobPrefix().isBlank() ? name() : spec.jobPrefix();
        return PathNormalizer.sanitizeName(prefix);
    }
}
