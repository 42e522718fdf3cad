package com.seqflow.core.command;

import com.seqflow.core.ConfigurationException;

import java.util.Set;

/**
 * A command template names placeholders that have no value.
 */
public class UnresolvedPlaceholderException extends ConfigurationException {

    private final Set<String> placeholders;

    public UnresolvedPlaceholderException(String message, Set<String> placeholders) {
        super(message);
        this.placeholders = Set.copyOf(placeholders);
    }

    public Set<String> placeholders() {
        return placeholders;
    }
}
