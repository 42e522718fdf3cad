package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.InputLocation;
import com.seqflow.pipelines.MapFamliWorkflow;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "map-famli", mixinStandardHelpOptions = true,
        description = "Align a set of FASTQ files against an existing reference with FAMLI")
@Component
public class MapFamliCommand extends PipelineCommand {

    @Mixin
    SampleSheetOptions sheet = new SampleSheetOptions();

    @Option(names = "--famli-db", required = true, description = "Location of the DIAMOND reference database")
    String famliDb;

    @Option(names = "--input-location", defaultValue = "S3", description = "Location of input data: S3 or SRA (default: ${DEFAULT-VALUE})")
    String inputLocation;

    @Option(names = "--output-folder", defaultValue = "famli", description = "Subfolder of the output root for the alignments")
    String outputFolder;

    @Option(names = "--famli-threads", defaultValue = "4", description = "CPUs for alignment with FAMLI")
    int threads;

    @Option(names = "--famli-mem", defaultValue = "10000", description = "Memory for alignment with FAMLI (MB)")
    int memoryMb;

    private final WorkflowFactory workflows;

    public MapFamliCommand(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var settings = new MapFamliWorkflow.Settings(famliDb, InputLocation.parse(inputLocation), outputRoot,
                outputFolder, threads, memoryMb);
        return workflows.mapFamli(settings).build(sheet.read());
    }
}
