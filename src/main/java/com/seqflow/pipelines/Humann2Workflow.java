package com.seqflow.pipelines;

import com.seqflow.core.dataset.SampleRow;
import com.seqflow.core.graph.TaskGraph;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ExternalFileTask;
import com.seqflow.core.task.OutputRef;
import com.seqflow.core.workflow.SampleWorkflow;

/**
 * Per sample: load reads, quality metrics and HUMAnN2 profiling. No fan-in.
 */
public class Humann2Workflow extends SampleWorkflow<Humann2Task> {

    public record Settings(String baseFolder, int threads, int memoryMb, String refDb) {
        public Settings {
            baseFolder = PathNormalizer.folder(baseFolder);
            refDb = refDb != null ? refDb : "";
        }
    }

    private final Settings settings;
    private final TargetFactory targets;
    private final ContainerDefaults containers;

    public Humann2Workflow(Settings settings, TargetFactory targets, ContainerDefaults containers) {
        this.settings = settings;
        this.targets = targets;
        this.containers = containers;
    }

    @Override
    public String name() {
        return "humann2";
    }

    @Override
    protected Humann2Task buildSampleBranch(SampleRow row, TaskGraph.Builder builder) {
        String sample = row.sampleId();
        String base = settings.baseFolder();

        var load = builder.add(new LoadFile("load_from_s3_" + sample, targets.of(row.source())));
        OutputRef reads = load.ref(ExternalFileTask.OUT_FILE);

        var fastqp = new FastqpTask("fastqp_" + sample, targets,
                PathNormalizer.join(base, "fastqp", sample + ".fastqp.tsv"),
                containers.images().getFastqp(), containers.spec("fastqp_" + sample, 1, 10000));
        builder.bind(fastqp, FastqpTask.IN_FASTQ, reads);

        var humann2 = new Humann2Task("humann2_" + sample, targets, sample,
                PathNormalizer.join(base, "humann2"), settings.threads(), settings.refDb(),
                containers.images().getHumann2(),
                containers.specWithRefdbs("humann2_" + sample, settings.threads(), settings.memoryMb()));
        builder.bind(humann2, Humann2Task.IN_FASTQ, reads);
        return humann2;
    }
}
