package com.seqflow.pipelines;

import com.seqflow.core.target.Target;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads FASTA records and picks out 16S transcripts.
 */
final class FastaRecords {

    /** Header without the leading {@code >}, sequence with line breaks removed. */
    record Record(String header, String sequence) {

        String id() {
            int space = header.indexOf(' ');
            return space < 0 ? header : header.substring(0, space);
        }

        boolean isSmallSubunit() {
            return header.contains(" 16S ") || header.contains(" SSU ");
        }
    }

    private FastaRecords() {
    }

    static List<Record> read(Target target) throws IOException {
        var records = new ArrayList<Record>();
        try (var reader = new BufferedReader(new InputStreamReader(target.openForRead(), StandardCharsets.UTF_8))) {
            String header = null;
            var sequence = new StringBuilder();
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(">")) {
                    if (header != null) {
                        records.add(new Record(header, sequence.toString()));
                    }
                    header = line.substring(1).trim();
                    sequence.setLength(0);
                } else if (header != null) {
                    sequence.append(line.trim());
                }
            }
            if (header != null) {
                records.add(new Record(header, sequence.toString()));
            }
        }
        return records;
    }

    static List<Record> smallSubunits(Target target) throws IOException {
        return read(target).stream().filter(Record::isSmallSubunit).toList();
    }
}
