package com.seqflow.pipelines;

import com.seqflow.core.ConfigurationException;

import java.util.Locale;

/**
 * Where the reads listed in a sample sheet come from.
 */
public enum InputLocation {
    /** The input column holds a storage location (object store URI or local path). */
    S3,
    /** The input column holds an SRA run accession. */
    SRA;

    public static InputLocation parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "S3", "STORE" -> S3;
            case "SRA" -> SRA;
            default -> throw new ConfigurationException("Input location must be S3 or SRA, got '" + value + "'");
        };
    }
}
