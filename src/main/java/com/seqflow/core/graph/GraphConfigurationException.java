package com.seqflow.core.graph;

import com.seqflow.core.ConfigurationException;

/**
 * A task graph is wired incorrectly: an unknown slot, an unbound required
 * input, or two different tasks sharing a name.
 */
public class GraphConfigurationException extends ConfigurationException {
    public GraphConfigurationException(String message) {
        super(message);
    }
}
