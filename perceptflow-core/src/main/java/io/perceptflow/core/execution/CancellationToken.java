package io.perceptflow.core.execution;

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation signal, checked by the executor between steps only.
///
/// A node call that is already running finishes, or times out, before cancellation takes
/// effect.
///
/// @implNote **Thread-safe**.
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /// Requests cancellation.
    ///
    /// @return true if this call changed the token's state
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
