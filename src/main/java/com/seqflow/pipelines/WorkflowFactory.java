package com.seqflow.pipelines;

import com.seqflow.core.target.TargetFactory;
import org.springframework.stereotype.Component;

/**
 * Creates workflows bound to the configured storage and container defaults.
 */
@Component
public class WorkflowFactory {

    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public WorkflowFactory(TargetFactory targets, PipelineProperties properties) {
        this.targets = targets;
        this.containers = new ContainerDefaults(properties);
    }

    public AssembleFamliWorkflow assembleFamli(AssembleFamliWorkflow.Settings settings) {
        return new AssembleFamliWorkflow(settings, targets, containers);
    }

    public MapFamliWorkflow mapFamli(MapFamliWorkflow.Settings settings) {
        return new MapFamliWorkflow(settings, targets, containers);
    }

    public MapVirusesWorkflow mapViruses(MapVirusesWorkflow.Settings settings) {
        return new MapVirusesWorkflow(settings, targets, containers);
    }

    public FetchPatricWorkflow fetchPatric(FetchPatricWorkflow.Settings settings) {
        return new FetchPatricWorkflow(settings, targets, containers);
    }

    public Humann2Workflow humann2(Humann2Workflow.Settings settings) {
        return new Humann2Workflow(settings, targets, containers);
    }

    public AnnotateGenomeWorkflow annotateGenome(AnnotateGenomeWorkflow.Settings settings) {
        return new AnnotateGenomeWorkflow(settings, targets, containers);
    }
}
