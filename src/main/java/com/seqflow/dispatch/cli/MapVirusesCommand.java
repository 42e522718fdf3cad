package com.seqflow.dispatch.cli;

import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.InputLocation;
import com.seqflow.pipelines.MapVirusesWorkflow;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

@Command(name = "map-viruses", mixinStandardHelpOptions = true,
        description = "Align a set of FASTQ files against a viral protein database")
@Component
public class MapVirusesCommand extends PipelineCommand {

    @Mixin
    SampleSheetOptions sheet = new SampleSheetOptions();

    @Option(names = "--ref-db-dmnd", required = true, description = "Viral protein database in DIAMOND format")
    String refDbDmnd;

    @Option(names = "--ref-db-metadata", required = true, description = "Metadata table for the viral database")
    String refDbMetadata;

    @Option(names = "--input-location", defaultValue = "S3", description = "Location of input data: S3 or SRA (default: ${DEFAULT-VALUE})")
    String inputLocation;

    @Option(names = "--output-folder", defaultValue = "map_viruses", description = "Subfolder of the output root for the alignments")
    String outputFolder;

    @Option(names = "--align-threads", defaultValue = "4", description = "CPUs for alignment")
    int threads;

    @Option(names = "--align-mem", defaultValue = "10000", description = "Memory for alignment (MB)")
    int memoryMb;

    private final WorkflowFactory workflows;

    public MapVirusesCommand(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var settings = new MapVirusesWorkflow.Settings(refDbDmnd, refDbMetadata, InputLocation.parse(inputLocation),
                outputRoot, outputFolder, threads, memoryMb);
        return workflows.mapViruses(settings).build(sheet.read());
    }
}
