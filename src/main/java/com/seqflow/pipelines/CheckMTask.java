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
 * Estimates genome completeness and contamination from called proteins.
 */
public class CheckMTask extends ToolTask {

    public static final String IN_FAA = "in_faa";
    public static final String OUT_TSV = "out_tsv";

    public CheckMTask(String name, TargetFactory targets, String sampleName, String outputFolder, int threads,
                      String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .build(),
                spec,
                image,
                Map.of(OUT_TSV, targets.of(PathNormalizer.join(outputFolder, sampleName + ".checkm.tsv"))));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FAA));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("run_checkm.py")
                .placeholder("--input", IN_FAA)
                .placeholder("--sample-name", "sample_name")
                .placeholder("--output-path", OUT_TSV)
                .placeholder("--threads", "threads")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
