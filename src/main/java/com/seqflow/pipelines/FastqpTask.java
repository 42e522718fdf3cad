package com.seqflow.pipelines;

import com.seqflow.core.command.CommandTemplate;
import com.seqflow.core.target.TargetFactory;
import com.seqflow.core.task.ContainerSpec;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.Parameters;

import java.util.List;
import java.util.Map;

/**
 * Computes read quality metrics for one FASTQ file.
 */
public class FastqpTask extends ToolTask {

    public static final String IN_FASTQ = "in_fastq";
    public static final String OUT_SUMMARY = "out_summary";

    public FastqpTask(String name, TargetFactory targets, String summaryPath, String image, ContainerSpec spec) {
        super(name,
                Parameters.builder().put("summary_path", summaryPath).build(),
                spec,
                image,
                Map.of(OUT_SUMMARY, targets.of(summaryPath)));
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.one(IN_FASTQ));
    }

    @Override
    public CommandTemplate command() {
        return CommandTemplate.builder("fastqp.py")
                .placeholder("--input", IN_FASTQ)
                .placeholder("--output", OUT_SUMMARY)
                .placeholder("--temp-folder", SCRATCH_PLACEHOLDER)
                .build();
    }
}
