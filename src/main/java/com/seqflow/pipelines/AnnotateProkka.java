package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.Parameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Annotates an assembly with Prokka, producing features (GFF) and proteins (FAA).
 */
public class AnnotateProkka extends ToolTask {

    public static final String IN_FASTA = "in_fasta";
    public static final String OUT_GFF = "out_gff";
    public static final String OUT_FAA = "out_faa";

    public AnnotateProkka(String name, TargetFactory targets, String sampleName, String outputFolder,
                          int threads, String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .build(),
                spec,
                image,
                outputs(targets, sampleName, outputFolder));
    }

    private static Map<String, Target> outputs(TargetFactory targets, String sampleName, String outputFolder) {
        var outputs = new LinkedHashMap<String, Target>();
        outputs.put(OUT_GFF, targets.of(PathNormalizer.join(outputFolder, sampleName + ".gff.gz")));
        outputs.put(OUT_FAA, targets.of(PathNormalizer.join(outputFolder, sampleName + ".faa.gz")));
        return outputs;
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTA));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("run_prokka.py")
                .placeholder("--input", IN_FASTA)
                .placeholder("--sample-name", "sample_name")
                .placeholder("--output-gff", OUT_GFF)
                .placeholder("--output-faa", OUT_FAA)
                .placeholder("--threads", "threads")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
