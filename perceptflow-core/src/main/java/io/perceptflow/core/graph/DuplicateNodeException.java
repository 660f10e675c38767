package io.perceptflow.core.graph;

import java.io.Serial;

/// Thrown when two node functions are registered under the same name.
public class DuplicateNodeException extends FatalConfigurationException {
    @Serial private static final long serialVersionUID = 6102975513920044188L;

    private final String nodeName;

    public DuplicateNodeException(String nodeName) {
        super("Node already registered: " + nodeName);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
