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
 * Functional profiling of one sample with HUMAnN2.
 */
public class Humann2Task extends ToolTask {

    public static final String IN_FASTQ = "in_fastq";
    public static final String OUT_JSON = "out_json";

    /**
     * @param refDb reference database path, as seen inside the container
     */
    public Humann2Task(String name, TargetFactory targets, String sampleName, String outputFolder, int threads,
                       String refDb, String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .put("ref_db", refDb)
                        .build(),
                spec,
                image,
                Map.of(OUT_JSON, targets.of(PathNormalizer.join(outputFolder, sampleName + ".json.gz"))));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTQ));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("run.py")
                .placeholder("--input", IN_FASTQ)
                .placeholder("--sample-name", "sample_name")
                .placeholder("--output-path", OUT_JSON)
                .placeholder("--ref-db", "ref_db")
                .placeholder("--threads", "threads")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
