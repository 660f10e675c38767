package io.perceptflow.core.graph;

import java.io.Serial;

/// Signals a defect in a graph or engine configuration discovered at build time.
///
/// These are the only exceptions the engine lets escape to callers. Runtime failures are
/// reported as values inside the session outcome.
public class FatalConfigurationException extends RuntimeException {
    @Serial private static final long serialVersionUID = -2817402945512369921L;

    public FatalConfigurationException(String message) {
        super(message);
    }

    public FatalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
