package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ExternalFileTask;
import com.seqflow.core.task.OutputRef;
import com.seqflow.core.workflow.SampleWorkflow;

import java.util.List;

/**
 * Aligns every sample against a viral protein database and its metadata
 * table, both loaded once.
 */
public class MapVirusesWorkflow extends SampleWorkflow<MapVirusesWorkflow.Branch> {

    public record Settings(
        String refDbDmnd,
        String refDbMetadata,
        InputLocation inputSource,
        String baseFolder,
        String outputFolder,
        int threads,
        int memoryMb
    ) {
        public Settings {
            if (refDbDmnd == null || refDbDmnd.isBlank() || refDbMetadata == null || refDbMetadata.isBlank()) {
                throw new ConfigurationException("Both the viral database and its metadata are required");
            }
            inputSource = inputSource != null ? inputSource : InputLocation.S3;
            baseFolder = PathNormalizer.folder(baseFolder);
            outputFolder = outputFolder == null || outputFolder.isBlank() ? "map_viruses" : outputFolder;
        }
    }

    public record Branch(SampleRow row, OutputRef reads) {}

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public MapVirusesWorkflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    @Override
    public String name() {
        return "map-viruses";
    }

    @Override
    protected void validate(SampleSheet sheet) {
        if (settings.inputSource() == InputLocation.SRA) {
            SampleReads.requireAccessions(sheet);
        }
    }

    @Override
    protected Branch buildSampleBranch(SampleRow row, TaskGraph.Builder builder) {
        return new Branch(row, SampleReads.add(row, settings.inputSource(), settings.baseFolder(), 4096,
                targets, containers, builder));
    }

    @Override
    protected void buildAggregates(List<Branch> branches, TaskGraph.Builder builder) {
        var dmnd = builder.add(new LoadFile("load_ref_db_dmnd", targets.of(settings.refDbDmnd())));
        var metadata = builder.add(new LoadFile("load_ref_db_metadata", targets.of(settings.refDbMetadata())));
        String folder = PathNormalizer.join(settings.baseFolder(), settings.outputFolder());

        for (Branch branch : branches) {
            String sample = branch.row().sampleId();
            var task = new MapVirusesTask("map_viruses_" + sample, targets, sample, folder, settings.threads(),
                    containers.images().getMapViruses(),
                    containers.spec("map_viruses_" + sample, settings.threads(), settings.memoryMb()));
            builder.bind(task, MapVirusesTask.IN_FASTQ, branch.reads());
            builder.bind(task, MapVirusesTask.IN_REF_DB_DMND, dmnd.ref(ExternalFileTask.OUT_FILE));
            builder.bind(task, MapVirusesTask.IN_REF_DB_METADATA, metadata.ref(ExternalFileTask.OUT_FILE));
        }
    }
}
