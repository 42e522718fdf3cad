package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.Parameters;

import java.util.List;
import java.util.Map;

/**
 * Assembles one sample with metaSPAdes into {@code <folder>/<sample>.fasta.gz}.
 */
public class AssembleMetaSpades extends ToolTask {

    public static final String IN_FASTQ = "in_fastq";
    public static final String OUT_FASTA = "out_fasta";

    /**
     * @param maxMemGb memory limit handed to the assembler, in GB
     */
    public AssembleMetaSpades(String name, TargetFactory targets, String sampleName, String outputFolder,
                              int threads, int maxMemGb, String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .put("max_mem", maxMemGb)
                        .build(),
                spec,
                image,
                Map.of(OUT_FASTA, targets.of(PathNormalizer.join(outputFolder, sampleName + ".fasta.gz"))));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTQ));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("run_metaspades.py")
                .placeholder("--input", IN_FASTQ)
                .placeholder("--sample-name", "sample_name")
                .placeholder("--output-path", OUT_FASTA)
                .placeholder("--threads", "threads")
                .placeholder("--max-mem", "max_mem")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
