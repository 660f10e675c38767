package io.perceptflow.core.graph;

import java.io.Serial;

/// Thrown when a graph refers to a node name that is not registered.
public class UnknownNodeException extends FatalConfigurationException {
    @Serial private static final long serialVersionUID = -4390154882093517760L;

    private final String nodeName;

    public UnknownNodeException(String nodeName, String referencedBy) {
        super("Unknown node '" + nodeName + "' referenced by " + referencedBy);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
