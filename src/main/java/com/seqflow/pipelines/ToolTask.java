package com.seqflow.pipelines;

import com.seqflow.core.target.Target;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.ContainerTask;
import com.seqflow.core.task.Parameters;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Container task wrapping one bioinformatics tool. Outputs are fixed at
 * construction from the task parameters.
 */
public abstract class ToolTask extends ContainerTask {

    private final String image;
    private final Map<String, Target> outputs;

    protected ToolTask(String name, Parameters parameters, ContainerSpec spec, String image,
                       Map<String, Target> outputs) {
        super(name, parameters, spec);
        this.image = image;
        this.outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    @Override
    public String image() {
        return image;
    }

    @Override
    public Map<String, Target> outputs() {
        return outputs;
    }
}
