package com.seqflow.pipelines;

import com.seqflow.core.target.Target;
import com.seqflow.core.task.AggregateTask;
import com.seqflow.core.task.InputSlot;
import com.seqflow.core.task.LocalTask;
import com.seqflow.core.task.Parameters;
import com.seqflow.core.task.TaskContext;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds a copy-number matrix with one row per 16S transcript and one column
 * per annotated product. Every transcript of a genome carries that genome's
 * product counts; products a genome lacks are 0.
 *
 * <p>Transcript and annotation inputs are paired by position, so both slots
 * must be bound in the same genome order.
 */
public class ExtractAnnotations extends LocalTask implements AggregateTask {

    private static final Logger log = LoggerFactory.getLogger(ExtractAnnotations.class);

    public static final String IN_TRANSCRIPTS = "in_transcripts";
    public static final String IN_ANNOTATIONS = "in_annotations";
    public static final String OUT_TSV = "out_tsv";

    static final String PRODUCT_COLUMN = "product";

    private static final CSVFormat ANNOTATION_FORMAT = CSVFormat.DEFAULT.builder()
            .setDelimiter('\t')
            .setQuote(null)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private static final CSVFormat MATRIX_FORMAT = CSVFormat.TDF.builder()
            .setRecordSeparator('\n')
            .build();

    private final Target output;

    public ExtractAnnotations(String name, Target output) {
        super(name, Parameters.builder().put("output", output.uri().toString()).build());
        this.output = output;
    }

    @Override
    public List<InputSlot> inputSlots() {
        return List.of(InputSlot.many(IN_TRANSCRIPTS), InputSlot.many(IN_ANNOTATIONS));
    }

    @Override
    public Map<String, Target> outputs() {
        return Map.of(OUT_TSV, output);
    }

    @Override
    public void run(TaskContext context) throws Exception {
        List<Target> transcripts = context.inputs(IN_TRANSCRIPTS);
        List<Target> annotations = context.inputs(IN_ANNOTATIONS);
        if (transcripts.size() != annotations.size()) {
            throw new InvalidGenomeDataException("Got " + transcripts.size() + " transcript files but "
                    + annotations.size() + " annotation files");
        }

        var rows = new LinkedHashMap<String, Map<String, Integer>>();
        var products = new TreeSet<String>();
        for (int i = 0; i < transcripts.size(); i++) {
            Map<String, Integer> counts = productCounts(annotations.get(i));
            products.addAll(counts.keySet());
            for (FastaRecords.Record record : FastaRecords.smallSubunits(transcripts.get(i))) {
                if (rows.putIfAbsent(record.id(), counts) != null) {
                    throw new InvalidGenomeDataException("Transcript " + record.id() + " found twice");
                }
            }
        }
        log.info("Writing {} transcripts x {} products to {}", rows.size(), products.size(), output);

        var header = new ArrayList<String>();
        header.add("transcript_id");
        header.addAll(products);
        context.output(OUT_TSV).write(out -> {
            var printer = new CSVPrinter(new OutputStreamWriter(out, StandardCharsets.UTF_8), MATRIX_FORMAT);
            printer.printRecord(header);
            for (Map.Entry<String, Map<String, Integer>> row : rows.entrySet()) {
                var values = new ArrayList<Object>(header.size());
                values.add(row.getKey());
                for (String product : products) {
                    values.add(row.getValue().getOrDefault(product, 0));
                }
                printer.printRecord(values);
            }
            printer.flush();
        });
    }

    static Map<String, Integer> productCounts(Target annotations) throws IOException {
        var counts = new TreeMap<String, Integer>();
        try (CSVParser parser = ANNOTATION_FORMAT.parse(
                new InputStreamReader(annotations.openForRead(), StandardCharsets.UTF_8))) {
            if (!parser.getHeaderNames().contains(PRODUCT_COLUMN)) {
                throw new InvalidGenomeDataException("No '" + PRODUCT_COLUMN + "' column in " + annotations);
            }
            for (CSVRecord record : parser) {
                if (record.isSet(PRODUCT_COLUMN) && !record.get(PRODUCT_COLUMN).isBlank()) {
                    counts.merge(record.get(PRODUCT_COLUMN), 1, Integer::sum);
                }
            }
        }
        return counts;
    }
}
