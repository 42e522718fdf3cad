package com.seqflow.dispatch.cli;

import com.seqflow.core.dataset.SampleSheetReader;
import com.seqflow.core.engine.PipelineEngine;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.pipelines.FetchPatricWorkflow;
import com.seqflow.pipelines.WorkflowFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;

@Command(name = "fetch-patric", mixinStandardHelpOptions = true,
        description = "Fetch functional annotations of PATRIC genomes and link them to 16S transcripts")
@Component
public class FetchPatricCommand extends PipelineCommand {

    @Option(names = "--genome-list", required = true, description = "Genome table with a header row, such as PATRIC genome_metadata")
    Path genomeList;

    @Option(names = "--genome-list-sep", defaultValue = "tab", description = "Field separator of the genome table (default: ${DEFAULT-VALUE})")
    String separator;

    @Option(names = "--genome-column", defaultValue = "genome_id", description = "Column holding the PATRIC genome ID (default: ${DEFAULT-VALUE})")
    String genomeColumn;

    @Option(names = "--ftp-root", defaultValue = FetchPatricWorkflow.DEFAULT_FTP_ROOT, description = "FTP folder with one subfolder per genome (default: ${DEFAULT-VALUE})")
    String ftpRoot;

    private final WorkflowFactory workflows;

    public FetchPatricCommand(PipelineEngine engine, WorkflowFactory workflows) {
        super(engine);
        this.workflows = workflows;
    }

    @Override
    protected TaskGraph buildGraph() {
        var genomes = new SampleSheetReader(SampleSheetReader.parseDelimiter(separator))
                .read(genomeList, genomeColumn, genomeColumn);
        var settings = new FetchPatricWorkflow.Settings(outputRoot, ftpRoot);
        return workflows.fetchPatric(settings).build(genomes);
    }
}
