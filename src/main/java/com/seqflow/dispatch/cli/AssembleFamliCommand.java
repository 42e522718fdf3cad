package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.AssembleFamliWorkflow;
import com.seqflow.pipelines.InputLocation;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * CLI command: seqflow assemble-famli
 * <p>
 * Assembles every sample, integrates the assemblies into one protein catalog
 * and aligns each sample against it with FAMLI.
 */
@Command(name = "assemble-famli", mixinStandardHelpOptions = true,
        description = "Assemble a set of FASTQ files, combine the assemblies, and align with FAMLI")
@Component
public class AssembleFamliCommand extends PipelineCommand {

    @Mixin
    SampleSheetOptions sheet = new SampleSheetOptions();

    @Option(names = "--project-name", required = true, description = "Name for the entire project (alphanumeric only)")
    String projectName;

    @Option(names = "--input-location", defaultValue = "S3", description = "Location of input data: S3 or SRA (default: ${DEFAULT-VALUE})")
    String inputLocation;

    @Option(names = "--assemble-threads", defaultValue = "4", description = "CPUs for assembly with metaSPAdes")
    int assembleThreads;

    @Option(names = "--assemble-mem", defaultValue = "10000", description = "Memory for assembly with metaSPAdes (MB)")
    int assembleMem;

    @Option(names = "--famli-threads", defaultValue = "4", description = "CPUs for alignment with FAMLI")
    int famliThreads;

    @Option(names = "--famli-mem", defaultValue = "10000", description = "Memory for alignment with FAMLI (MB)")
    int famliMem;

    private final WorkflowFactory workflows;

    public AssembleFamliCommand(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var settings = new AssembleFamliWorkflow.Settings(projectName, InputLocation.parse(inputLocation),
                outputRoot, assembleThreads, assembleMem, famliThreads, famliMem);
        return workflows.assembleFamli(settings).build(sheet.read());
    }
}
