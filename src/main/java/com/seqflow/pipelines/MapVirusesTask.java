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
 * Aligns one sample's reads against a viral protein database, keeping the alignments.
 */
public class MapVirusesTask extends ToolTask {

    public static final String IN_FASTQ = "in_fastq";
    public static final String IN_REF_DB_DMND = "in_ref_db_dmnd";
    public static final String IN_REF_DB_METADATA = "in_ref_db_metadata";
    public static final String OUT_JSON = "out_json";
    public static final String OUT_SAM = "out_sam";

    public MapVirusesTask(String name, TargetFactory targets, String sampleName, String outputFolder, int threads,
                          String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sample_name", sampleName)
                        .put("output_folder", outputFolder)
                        .put("threads", threads)
                        .build(),
                spec,
                image,
                Map.of(
                        OUT_JSON, targets.of(PathNormalizer.join(outputFolder, sampleName + ".json.gz")),
                        OUT_SAM, targets.of(PathNormalizer.join(outputFolder, sampleName + ".sam.gz"))));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTQ), InputSlot.one(IN_REF_DB_METADATA), InputSlot.one(IN_REF_DB_DMND));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("map_viruses.py")
                .placeholder("--input", IN_FASTQ)
                .placeholder("--metadata", IN_REF_DB_METADATA)
                .placeholder("--ref-db", IN_REF_DB_DMND)
                .placeholder("--output-path", OUT_JSON)
                .placeholder("--threads", "threads")
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .arg("--keep-alignments")
                .build();
    }
}
