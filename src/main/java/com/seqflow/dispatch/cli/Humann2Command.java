package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.Humann2Workflow;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "humann2", mixinStandardHelpOptions = true,
        description = "Analyze a set of FASTQ files with HUMAnN2")
@Component
public class Humann2Command extends PipelineCommand {

    @Mixin
    SampleSheetOptions sheet = new SampleSheetOptions();

    @Option(names = "--humann2-threads", defaultValue = "4", description = "CPUs for HUMAnN2")
    int threads;

    @Option(names = "--humann2-mem", defaultValue = "10000", description = "Memory for HUMAnN2 (MB)")
    int memoryMb;

    @Option(names = "--humann2-ref-db", required = true, description = "Reference database for HUMAnN2")
    String refDb;

    private final WorkflowFactory workflows;

    public Humann2Command(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var settings = new Humann2Workflow.Settings(outputRoot, threads, memoryMb, refDb);
        return workflows.humann2(settings).build(sheet.read());
    }
}
