package com.seqflow.pipelines;

import com.seqflow.core.target.Target;
import com.seqflow.core.task.AggregateTask;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.LocalTask;
import com.seqflow.core.task.Parameters;
import com.seqflow.core.task.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects every 16S transcript of every genome into one FASTA file keyed by
 * transcript ID.
 */
public class Extract16S extends LocalTask implements AggregateTask {

    private static final Logger log = LoggerFactory.getLogger(Extract16S.class);

    public static final String IN_TRANSCRIPTS = "in_transcripts";
    public static final String OUT_FASTA = "out_fasta";

    private final Target output;

    public Extract16S(String name, Target output) {
        super(name, Parameters.builder().put("output", output.uri().toString()).build());
        this.output = output;
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.many(IN_TRANSCRIPTS));
    }

    @Override
    public Map<String, Target> outputs() {
        return Map.of(OUT_FASTA, output);
    }

    @Override
    public void run(TaskContext context) throws Exception {
        var transcripts = new LinkedHashMap<String, String>();
        for (Target input : context.inputs(IN_TRANSCRIPTS)) {
            for (FastaRecords.Record record : FastaRecords.smallSubunits(input)) {
                if (transcripts.putIfAbsent(record.id(), record.sequence()) != null) {
                    throw new InvalidGenomeDataException("Duplicated transcript ID " + record.id() + " in " + input);
                }
            }
        }
        log.info("Writing {} 16S transcripts to {}", transcripts.size(), output);

        context.output(OUT_FASTA).write(out -> {
            var writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
            for (Map.Entry<String, String> entry : transcripts.entrySet()) {
                writer.write(">" + entry.getKey() + "\n" + entry.getValue() + "\n");
            }
            writer.flush();
        });
    }
}
