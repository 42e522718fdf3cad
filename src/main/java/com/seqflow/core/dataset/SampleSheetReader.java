package com.seqflow.core.dataset;

import com.seqflow.core.ConfigurationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited sample sheet with a header row.
 */
public class SampleSheetReader {

    private static final Logger log = LoggerFactory.getLogger(SampleSheetReader.class);

    private final char delimiter;

    public SampleSheetReader(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Parses a delimiter given on the command line. Accepts a single character,
     * {@code \t} or {@code tab}.
     */
    public static char parseDelimiter(String value) {
        if (value == null || value.isEmpty()) {
            return ',';
        }
        if ("\\t".equals(value) || "tab".equalsIgnoreCase(value) || "\t".equals(value)) {
            return '\t';
        }
        if (value.length() != 1) {
            throw new ConfigurationException("Separator must be a single character, \\t or 'tab': " + value);
        }
        return value.charAt(0);
    }

    public SampleSheet read(Path path, String sampleColumn, String sourceColumn) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString(), sampleColumn, sourceColumn);
        } catch (NoSuchFileException e) {
            throw new DatasetValidationException("Sample sheet not found: " + path, e);
        } catch (IOException e) {
            throw new DatasetValidationException("Could not read sample sheet " + path, e);
        }
    }

    public SampleSheet read(Reader reader, String source, String sampleColumn, String sourceColumn) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (CSVParser parser = format.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            var records = new ArrayList<Map<String, String>>();
            for (CSVRecord record : parser) {
                var values = new LinkedHashMap<String, String>();
                for (String column : header) {
                    values.put(column, record.isSet(column) ? record.get(column) : "");
                }
                records.add(values);
            }
            log.info("Read {} samples from {} (columns: {})", records.size(), source, header);
            return SampleSheet.of(source, header, records, sampleColumn, sourceColumn);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new DatasetValidationException("Malformed sample sheet " + source + ": " + e.getMessage(), e);
        }
    }
}
