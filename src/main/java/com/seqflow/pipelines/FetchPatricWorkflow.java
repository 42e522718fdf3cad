package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.OutputRef;
import com.seqflow.core.workflow.SampleWorkflow;

import java.util.List;

/**
 * Downloads the transcripts and functional annotations of every listed PATRIC
 * genome, then builds one FASTA of all 16S transcripts and one table of
 * product copy numbers per 16S transcript.
 *
 * <p>Each sheet row is one genome; its sample ID is the PATRIC genome ID.
 */
public class FetchPatricWorkflow extends SampleWorkflow<FetchPatricWorkflow.Branch> {

    public static final String DEFAULT_FTP_ROOT = "ftp://ftp.patricbrc.org/genomes";

    /**
     * @param baseFolder root of every output, one subfolder per genome
     * @param ftpRoot    folder holding one subfolder per genome ID
     */
    public record Settings(String baseFolder, String ftpRoot) {
        public Settings {
            baseFolder = PathNormalizer.folder(baseFolder);
            ftpRoot = ftpRoot == null || ftpRoot.isBlank() ? DEFAULT_FTP_ROOT : ftpRoot;
            if (!ftpRoot.startsWith("ftp://")) {
                throw new ConfigurationException("FTP root must start with ftp://, got '" + ftpRoot + "'");
            }
            while (ftpRoot.endsWith("/")) {
                ftpRoot = ftpRoot.substring(0, ftpRoot.length() - 1);
            }
        }
    }

    public record Branch(String genomeId, OutputRef transcripts, OutputRef annotations) {}

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public FetchPatricWorkflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    @Override
    public String name() {
        return "fetch-patric";
    }

    @Override
    protected Branch buildSampleBranch(SampleRow row, TaskGraph.Builder builder) {
        String genome = row.sampleId();
        String folder = PathNormalizer.join(settings.baseFolder(), genome);

        var annotations = builder.add(transfer("fetch_patric_annotations_" + genome,
                genomeUrl(genome, "PATRIC.pathway.tab"), PathNormalizer.join(folder, "annotation.tsv")));
        var transcripts = builder.add(transfer("fetch_patric_transcripts_" + genome,
                genomeUrl(genome, "PATRIC.frn"), PathNormalizer.join(folder, "transcripts.frn")));

        return new Branch(genome, transcripts.ref(TransferFtpFile.OUT_FILE), annotations.ref(TransferFtpFile.OUT_FILE));
    }

    @Override
    protected void buildAggregates(List<Branch> branches, TaskGraph.Builder builder) {
        List<OutputRef> transcripts = branches.stream().map(Branch::transcripts).toList();

        var all16S = new Extract16S("extract_all_16S",
                targets.of(PathNormalizer.join(settings.baseFolder(), "transcripts.fasta")));
        builder.bindAll(all16S, Extract16S.IN_TRANSCRIPTS, transcripts);

        var annotations = new ExtractAnnotations("extract_all_annotations",
                targets.of(PathNormalizer.join(settings.baseFolder(), "annotations.tsv")));
        builder.bindAll(annotations, ExtractAnnotations.IN_TRANSCRIPTS, transcripts);
        builder.bindAll(annotations, ExtractAnnotations.IN_ANNOTATIONS,
                branches.stream().map(Branch::annotations).toList());
    }

    private TransferFtpFile transfer(String name, String url, String destination) {
        return new TransferFtpFile(name, url, targets.of(destination), containers.images().getTransfer(),
                containers.spec(name, 1, 1000));
    }

    private String genomeUrl(String genome, String suffix) {
        return settings.ftpRoot() + "/" + genome + "/" + genome + "." + suffix;
    }
}
