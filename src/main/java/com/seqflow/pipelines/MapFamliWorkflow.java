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
 * Aligns every sample against an existing FAMLI reference database. The
 * database is loaded once and shared by all alignments.
 */
public class MapFamliWorkflow extends SampleWorkflow<MapFamliWorkflow.Branch> {

    /**
     * @param famliDb      location of the DIAMOND reference database
     * @param inputSource  where the reads come from
     * @param baseFolder   root of every output
     * @param outputFolder subfolder of {@code baseFolder} for the alignments
     */
    public record Settings(
        String famliDb,
        InputLocation inputSource,
        String baseFolder,
        String outputFolder,
        int threads,
        int memoryMb
    ) {
        public Settings {
            if (famliDb == null || famliDb.isBlank()) {
                throw new ConfigurationException("A FAMLI reference database is required");
            }
            inputSource = inputSource != null ? inputSource : InputLocation.S3;
            baseFolder = PathNormalizer.folder(baseFolder);
            outputFolder = outputFolder == null || outputFolder.isBlank() ? "famli" : outputFolder;
        }
    }

    public record Branch(SampleRow row, OutputRef reads) {}

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public MapFamliWorkflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    @Override
    public String name() {
        return "map-famli";
    }

    @Override
    protected void validate(SampleSheet sheet) {
        if (settings.inputSource() == InputLocation.SRA) {
            SampleReads.requireAccessions(sheet);
        }
    }

    @Override
    protected Branch buildSampleBranch(SampleRow row, TaskGraph.Builder builder) {
        return new Branch(row, SampleReads.add(row, settings.inputSource(), settings.baseFolder(), 32000,
                targets, containers, builder));
    }

    @Override
    protected void buildAggregates(List<Branch> branches, TaskGraph.Builder builder) {
        var db = builder.add(new LoadFile("load_db_from_s3", targets.of(settings.famliDb())));
        String folder = PathNormalizer.join(settings.baseFolder(), settings.outputFolder());

        for (Branch branch : branches) {
            String sample = branch.row().sampleId();
            var famli = new FamliTask("famli_" + sample, targets, sample, folder, settings.threads(),
                    containers.images().getFamli(),
                    containers.spec("famli_" + sample, settings.threads(), settings.memoryMb()));
            builder.bind(famli, FamliTask.IN_FASTQ, branch.reads());
            builder.bind(famli, FamliTask.IN_REF_DMND, db.ref(ExternalFileTask.OUT_FILE));
        }
    }
}
