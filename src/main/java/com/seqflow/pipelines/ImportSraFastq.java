package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.Parameters;

import java.util.Map;

/**
 * Downloads the reads of an SRA accession to {@code <base>/reads/<accession>.fastq.gz}.
 */
public class ImportSraFastq extends ToolTask {

    public static final String OUT_FASTQ = "out_fastq";

    public ImportSraFastq(String name, TargetFactory targets, String accession, String baseFolder,
                          String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("sra_accession", accession)
                        .put("base_folder", baseFolder)
                        .build(),
                spec,
                image,
                Map.of(OUT_FASTQ, targets.of(PathNormalizer.join(baseFolder, "reads", accession + ".fastq.gz"))));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("get_sra.py")
                .placeholder("--accession", "sra_accession")
                .placeholder("--output-path", OUT_FASTQ)
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
