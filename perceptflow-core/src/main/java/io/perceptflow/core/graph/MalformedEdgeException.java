package io.perceptflow.core.graph;

import java.io.Serial;

/// Thrown when the edge table is inconsistent: a missing default target, a second edge for
/// the same source, or a node with no outgoing edge.
public class MalformedEdgeException extends FatalConfigurationException {
    @Serial private static final long serialVersionUID = 1733460391260178425L;

    public MalformedEdgeException(String message) {
        super(message);
    }
}
