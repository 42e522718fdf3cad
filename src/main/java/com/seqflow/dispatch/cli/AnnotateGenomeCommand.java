package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.AnnotateGenomeWorkflow;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "annotate-genome", mixinStandardHelpOptions = true,
        description = "Annotate a bacterial genome and run CheckM")
@Component
public class AnnotateGenomeCommand extends PipelineCommand {

    @Option(names = "--genome-fasta", required = true, description = "Location of the genome FASTA file")
    String genomeFasta;

    @Option(names = "--genome-name", required = true, description = "Name of the genome (prefix for output files)")
    String genomeName;

    @Option(names = "--checkm-threads", defaultValue = "8", description = "CPUs for annotation")
    int threads;

    @Option(names = "--checkm-mem", defaultValue = "64000", description = "Memory for annotation (MB)")
    int memoryMb;

    private final WorkflowFactory workflows;

    public AnnotateGenomeCommand(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var settings = new AnnotateGenomeWorkflow.Settings(genomeFasta, genomeName, outputRoot, threads, memoryMb);
        return workflows.annotateGenome(settings).build();
    }
}
