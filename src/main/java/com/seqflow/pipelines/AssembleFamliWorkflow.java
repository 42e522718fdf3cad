package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.OutputRef;
import com.seqflow.core.workflow.SampleWorkflow;

import java.util.List;

/**
 * Per sample: load reads, quality metrics, metaSPAdes assembly and Prokka
 * annotation. Then one integration step over all annotations, and a FAMLI
 * alignment of each sample against the integrated reference.
 *
 * <p>Terminal tasks are the FAMLI and fastqp tasks.
 */
public class AssembleFamliWorkflow extends SampleWorkflow<AssembleFamliWorkflow.Branch> {

    /**
     * @param projectName  used to name the integrated assembly, {@code [A-Za-z0-9_]} only
     * @param inputSource  where the reads come from
     * @param baseFolder   root of every output
     * @param assembleThreads cpus for assembly and annotation
     * @param assembleMemMb   memory for assembly and annotation, in MB
     * @param famliThreads cpus for alignment
     * @param famliMemMb   memory for alignment, in MB
     */
    public record Settings(
        String projectName,
        InputLocation inputSource,
        String baseFolder,
        int assembleThreads,
        int assembleMemMb,
        int famliThreads,
        int famliMemMb
    ) {
        public Settings {
            if (projectName == null || !projectName.matches("[A-Za-z0-9_]+")) {
                throw new ConfigurationException("Project name must be alphanumeric, got '" + projectName + "'");
            }
            inputSource = inputSource != null ? inputSource : InputLocation.S3;
            baseFolder = PathNormalizer.folder(baseFolder);
        }
    }

    /**
     * Per-sample tasks the fan-in step and the alignments attach to.
     */
    public record Branch(SampleRow row, OutputRef reads, AnnotateProkka prokka) {}

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public AssembleFamliWorkflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    @Override
    public String name() {
        return "assemble-famli";
    }

    @Override
    protected void validate(SampleSheet sheet) {
        if (settings.inputSource() == InputLocation.SRA) {
            SampleReads.requireAccessions(sheet);
        }
    }

    @Override
    protected Branch buildSampleBranch(SampleRow row, TaskGraph.Builder builder) {
        String sample = row.sampleId();
        String base = settings.baseFolder();
        var images = containers.images();

        OutputRef reads = SampleReads.add(row, settings.inputSource(), base, 32000, targets, containers, builder);

        var fastqp = new FastqpTask("fastqp_" + sample, targets,
                PathNormalizer.join(base, "fastqp", sample + ".fastqp.tsv"),
                images.getFastqp(), containers.spec("fastqp_" + sample, 1, 32000));
        builder.bind(fastqp, FastqpTask.IN_FASTQ, reads);

        var metaspades = new AssembleMetaSpades("metaspades_" + sample, targets, sample,
                PathNormalizer.join(base, "metaspades"), settings.assembleThreads(),
                settings.assembleMemMb() / 1000, images.getMetaspades(),
                containers.spec("metaspades_" + sample, settings.assembleThreads(), settings.assembleMemMb()));
        builder.bind(metaspades, AssembleMetaSpades.IN_FASTQ, reads);

        var prokka = new AnnotateProkka("prokka_" + sample, targets, sample,
                PathNormalizer.join(base, "prokka"), settings.assembleThreads(), images.getProkka(),
                containers.spec("prokka_" + sample, settings.assembleThreads(), settings.assembleMemMb()));
        builder.bind(prokka, AnnotateProkka.IN_FASTA, metaspades.ref(AssembleMetaSpades.OUT_FASTA));

        return new Branch(row, reads, prokka);
    }

    @Override
    protected void buildAggregates(List<Branch> branches, TaskGraph.Builder builder) {
        String project = settings.projectName();
        var integrate = new IntegrateAssemblies("integrate_assemblies-" + project, targets, project,
                PathNormalizer.join(settings.baseFolder(), "integrated_assembly"),
                containers.images().getIntegrateAssemblies(),
                containers.spec("integrate_assemblies_" + project, 8, 120000));
        builder.bindAll(integrate, IntegrateAssemblies.IN_GFF_LIST,
                branches.stream().map(b -> b.prokka().ref(AnnotateProkka.OUT_GFF)).toList());
        builder.bindAll(integrate, IntegrateAssemblies.IN_FAA_LIST,
                branches.stream().map(b -> b.prokka().ref(AnnotateProkka.OUT_FAA)).toList());

        for (Branch branch : branches) {
            String sample = branch.row().sampleId();
            var famli = new FamliTask("famli_" + sample, targets, sample,
                    PathNormalizer.join(settings.baseFolder(), "famli"), settings.famliThreads(),
                    containers.images().getFamli(),
                    containers.spec("famli_" + sample, settings.famliThreads(), settings.famliMemMb()));
            builder.bind(famli, FamliTask.IN_FASTQ, branch.reads());
            builder.bind(famli, FamliTask.IN_REF_DMND, integrate.ref(IntegrateAssemblies.OUT_DMND));
        }
    }
}
