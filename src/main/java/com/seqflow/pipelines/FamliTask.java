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
 * Aligns one sample's reads against a protein reference with FAMLI.
 */
public class FamliTask extends ToolTask {

    public static final String IN_FASTQ = "in_fastq";
    public static final String IN_REF_DMND = "in_ref_dmnd";
    public static final String OUT_JSON = "out_json";

    public FamliTask(String name, TargetFactory targets, String sampleName, String outputFolder, int threads,
                     String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .build(),
                spec,
                image,
                Map.of(OUT_JSON, targets.of(PathNormalizer.join(outputFolder, sampleName + ".json.gz"))));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTQ), InputSlot.one(IN_REF_DMND));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("famli")
                .arg("align")
                .placeholder("--input", IN_FASTQ)
                .placeholder("--sample-name", "sample_name")
                .placeholder("--ref-db", IN_REF_DMND)
                .placeholder("--output-path", OUT_JSON)
                .placeholder("--threads", "threads")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
