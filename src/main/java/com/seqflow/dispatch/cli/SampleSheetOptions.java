package com.seqflow.dispatch.cli;

import com.seqflow.core.dataset.SampleSheet;
import com.seqflow.core.dataset.SampleSheetReader;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Flags locating the sample sheet and its key columns.
 */
public class SampleSheetOptions {

    @Option(names = "--metadata", required = true, description = "Sample sheet (delimited table with a header row)")
    Path metadata;

    @Option(names = "--metadata-sep", defaultValue = ",", description = "Field separator, ',' or '\\t' (default: ${DEFAULT-VALUE})")
    String separator;

    @Option(names = "--sample-column", required = true, description = "Column holding the sample name")
    String sampleColumn;

    @Option(names = "--input-column", required = true, description = "Column holding the input location")
    String inputColumn;

    SampleSheet read() {
        var reader = new SampleSheetReader(SampleSheetReader.parseDelimiter(separator));
        return reader.read(metadata, sampleColumn, inputColumn);
    }
}
