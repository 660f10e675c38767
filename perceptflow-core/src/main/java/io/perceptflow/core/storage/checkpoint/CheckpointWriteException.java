package io.perceptflow.core.storage.checkpoint;

import java.io.Serial;

/// Thrown when a checkpoint cannot be persisted.
///
/// The executor turns this into a fatal session outcome when durable checkpoints are
/// required, and into a logged warning otherwise.
public class CheckpointWriteException extends RuntimeException {
    @Serial private static final long serialVersionUID = 8830219475121667203L;

    public CheckpointWriteException(String message) {
        super(message);
    }

    public CheckpointWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
