package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ExternalFileTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Annotates a single genome: Prokka gene calling, then CheckM on the called proteins.
 */
public class AnnotateGenomeWorkflow {

    private static final Logger log = LoggerFactory.getLogger(AnnotateGenomeWorkflow.class);

    private static final int CHECKM_THREADS = 8;
    private static final int CHECKM_MEMORY_MB = 64000;

    /**
     * @param genomeFasta location of the genome FASTA
     * @param genomeName  prefix for output files
     * @param baseFolder  root of every output
     * @param threads     cpus for annotation
     * @param memoryMb    memory for annotation, in MB
     */
    public record Settings(String genomeFasta, String genomeName, String baseFolder, int threads, int memoryMb) {
        public Settings {
            if (genomeFasta == null || genomeFasta.isBlank()) {
                throw new ConfigurationException("Genome FASTA location must not be blank");
            }
            if (genomeName == null || genomeName.isBlank()) {
                throw new ConfigurationException("Genome name must not be blank");
            }
            baseFolder = PathNormalizer.folder(baseFolder);
        }
    }

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public AnnotateGenomeWorkflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    public TaskGraph build() {
        String genome = settings.genomeName();
        TaskGraph.Builder builder = TaskGraph.builder();

        var fasta = builder.add(new LoadFile("load_genome_fasta", targets.of(settings.genomeFasta())));

        var prokka = new AnnotateProkka("annotate_prokka_" + genome, targets, genome,
                PathNormalizer.join(settings.baseFolder(), "prokka"), settings.threads(),
                containers.images().getProkka(),
                containers.spec("annotate_prokka_" + genome, settings.threads(), settings.memoryMb()));
        builder.bind(prokka, AnnotateProkka.IN_FASTA, fasta.ref(ExternalFileTask.OUT_FILE));

        var checkm = new CheckMTask("checkm_" + genome, targets, genome,
                PathNormalizer.join(settings.baseFolder(), "checkm"), CHECKM_THREADS,
                containers.images().getCheckm(),
                containers.spec("checkm_" + genome, CHECKM_THREADS, CHECKM_MEMORY_MB));
        builder.bind(checkm, CheckMTask.IN_FAA, prokka.ref(AnnotateProkka.OUT_FAA));

        TaskGraph graph = builder.build();
        log.info("Workflow annotate-genome: genome {}, {} tasks", genome, graph.size());
        return graph;
    }
}
