package com.seqflow.core.dataset;

import java.util.Map;

/**
 * One sample of a sample sheet.
 *
 * @param index      zero-based row position
 * @param sampleId   value of the sample identifier column
 * @param source     value of the source location column
 * @param attributes every column of the row, including the two above
 */
public record SampleRow(int index, String sampleId, String source, Map<String, String> attributes) {

    public SampleRow {
        attributes = Map.copyOf(attributes);
    }

    public String attribute(String column) {
        return attributes.get(column);
    }
}
