package io.perceptflow.core.execution.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Bounded event buffer between the executor and a stream consumer.
///
/// The producer never blocks. When the buffer is full the oldest event is dropped to make
/// room; the checkpoint store stays the source of truth for the complete history.
///
/// ### Contracts
/// - **Invariant**: events leave the buffer in the order they entered
/// - **Invariant**: at most `capacity` events are held
/// - after {@link #close()} further offers are ignored and {@link #take()} drains the
///   remaining events, then returns null
///
/// @implNote **Thread-safe**. One producer and one consumer are expected.
public final class StepEventBuffer {

    private static final Logger logger = Logger.getLogger(StepEventBuffer.class.getName());

    private final int capacity;
    private final Deque<StepEvent> events = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean closed;
    private long dropped;

    public StepEventBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /// Adds an event, dropping the oldest one if the buffer is full.
    ///
    /// @param event the event, not null
    /// @return false if an older event had to be dropped or the buffer is closed
    public boolean offer(StepEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            boolean dropping = events.size() >= capacity;
            if (dropping) {
                StepEvent oldest = events.pollFirst();
                dropped++;
                logger.fine(
                        "Stream buffer full, dropped event of step "
                                + oldest.stepIndex()
                                + " for session "
                                + oldest.sessionId());
            }
            events.addLast(event);
            changed.signalAll();
            return !dropping;
        } finally {
            lock.unlock();
        }
    }

    /// Removes the oldest event, waiting until one is available or the buffer is closed.
    ///
    /// @return the next event, or null once the buffer is closed and drained
    /// @throws InterruptedException if interrupted while waiting
    public StepEvent take() throws InterruptedException {
        lock.lock();
        try {
            while (events.isEmpty() && !closed) {
                changed.await();
            }
            return events.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /// Removes the oldest event, waiting at most `timeout`.
    ///
    /// @return the next event, or null on timeout or when closed and drained
    /// @throws InterruptedException if interrupted while waiting
    public StepEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (events.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = changed.awaitNanos(nanos);
            }
            return events.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /// Marks the end of the event sequence and wakes up a waiting consumer.
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /// Returns how many events were dropped because the consumer fell behind.
    public long droppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }
}
