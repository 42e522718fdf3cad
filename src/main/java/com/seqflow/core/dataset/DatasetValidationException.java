package com.seqflow.core.dataset;

import com.seqflow.core.ConfigurationException;

import java.util.List;

/**
 * The sample sheet is unusable. Carries every problem found, not just the first.
 */
public class DatasetValidationException extends ConfigurationException {

    private final List<String> problems;

    public DatasetValidationException(String source, List<String> problems) {
        super("Invalid sample sheet " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public DatasetValidationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> problems() {
        return problems;
    }
}
