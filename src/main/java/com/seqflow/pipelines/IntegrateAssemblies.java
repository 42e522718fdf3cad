package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.PathNormalizer;
import com.seqflow.core.target.Target;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.AggregateTask;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.Parameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines the annotated assemblies of every sample into one deduplicated
 * protein catalog with its DIAMOND database and gene annotation table.
 */
public class IntegrateAssemblies extends ToolTask implements AggregateTask {

    public static final String IN_GFF_LIST = "in_gff_list";
    public static final String IN_FAA_LIST = "in_faa_list";
    public static final String OUT_FASTA = "out_fasta";
    public static final String OUT_DMND = "out_dmnd";
    public static final String OUT_CSV = "out_csv";

    public IntegrateAssemblies(String name, TargetFactory targets, String outputPrefix, String outputFolder,
                               String image, ContainerSpec spec) {
        super(name,
                Parameters.builder()
                        .put("output_prefix", outputPrefix)
                        .put("output_folder", outputFolder)
                        .build(),
                spec,
                image,
                outputs(targets, outputPrefix, outputFolder));
    }

    private static Map<String, Target> outputs(TargetFactory targets, String prefix, String folder) {
        var outputs = new LinkedHashMap<String, Target>();
        outputs.put(OUT_FASTA, targets.of(PathNormalizer.join(folder, prefix + ".fasta.gz")));
        outputs.put(OUT_DMND, targets.of(PathNormalizer.join(folder, prefix + ".dmnd")));
        outputs.put(OUT_CSV, targets.of(PathNormalizer.join(folder, prefix + ".csv.gz")));
        return outputs;
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.many(IN_GFF_LIST), InputSlot.many(IN_FAA_LIST));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("integrate_assemblies.py")
                .placeholder("--gff", IN_GFF_LIST)
                .placeholder("--faa", IN_FAA_LIST)
                .placeholder("--output-fasta", OUT_FASTA)
                .placeholder("--output-dmnd", OUT_DMND)
                .placeholder("--output-csv", OUT_CSV)
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
