package com.seqflow.core.dataset;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validated, ordered list of samples driving a fan-out workflow.
 *
 * <p>Both the sample identifier and the source location column must be present,
 * non-blank and unique across rows.
 */
public final class SampleSheet {

    private final String source;
    private final String sampleColumn;
    private final String sourceColumn;
    private final List<SampleRow> rows;

    private SampleSheet(String source, String sampleColumn, String sourceColumn, List<SampleRow> rows) {
        this.source = source;
        this.sampleColumn = sampleColumn;
        this.sourceColumn = sourceColumn;
        this.rows = List.copyOf(rows);
    }

    /**
     * Validates raw records and builds the sheet.
     *
     * @param source       description of where the records came from, for messages
     * @param header       column names in file order
     * @param records      one map of column to value per row
     * @param sampleColumn name of the sample identifier column
     * @param sourceColumn name of the source location column
     * @throws DatasetValidationException listing every problem found
     */
    public static SampleSheet of(String source, List<String> header, List<Map<String, String>> records,
                                 String sampleColumn, String sourceColumn) {
        var problems = new ArrayList<String>();
        for (String column : List.of(sampleColumn, sourceColumn)) {
            if (!header.contains(column)) {
                problems.add("column '" + column + "' not found (columns: " + header + ")");
            }
        }
        if (!problems.isEmpty()) {
            throw new DatasetValidationException(source, problems);
        }

        var rows = new ArrayList<SampleRow>(records.size());
        Map<String, Integer> seenIds = new HashMap<>();
        Map<String, Integer> seenSources = new HashMap<>();
        for (int i = 0; i < records.size(); i++) {
            Map<String, String> record = records.get(i);
            String sampleId = trimmed(record.get(sampleColumn));
            String location = trimmed(record.get(sourceColumn));
            int line = i + 1;
            if (sampleId.isEmpty()) {
                problems.add("row " + line + ": blank " + sampleColumn);
            } else {
                Integer previous = seenIds.putIfAbsent(sampleId, line);
                if (previous != null) {
                    problems.add("row " + line + ": duplicate " + sampleColumn + " '" + sampleId
                            + "' (first seen in row " + previous + ")");
                }
            }
            if (location.isEmpty()) {
                problems.add("row " + line + ": blank " + sourceColumn);
            } else {
                Integer previous = seenSources.putIfAbsent(location, line);
                if (previous != null) {
                    problems.add("row " + line + ": duplicate " + sourceColumn + " '" + location
                            + "' (first seen in row " + previous + ")");
                }
            }
            var attributes = new HashMap<String, String>();
            record.forEach((k, v) -> attributes.put(k, v != null ? v : ""));
            rows.add(new SampleRow(i, sampleId, location, attributes));
        }
        if (!problems.isEmpty()) {
            throw new DatasetValidationException(source, problems);
        }
        return new SampleSheet(source, sampleColumn, sourceColumn, rows);
    }

    public String source() {
        return source;
    }

    public String sampleColumn() {
        return sampleColumn;
    }

    public String sourceColumn() {
        return sourceColumn;
    }

    public List<SampleRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}
