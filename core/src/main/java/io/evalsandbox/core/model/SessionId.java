package io.evalsandbox.core.model;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Opaque, never-reused session identifier. Instances compare by identity only: two ids are equal exactly when
 * they are the same object, so an id cannot be forged from its textual form.
 */
public final class SessionId {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final long sequence;

    private SessionId(long sequence) {
        this.sequence = sequence;
    }

    /** Generates a fresh identifier from the process-wide sequence. */
    public static SessionId next() {
        return new SessionId(SEQUENCE.incrementAndGet());
    }

    /** Monotonic creation number, useful for ordering in logs. */
    public long sequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "session-" + sequence;
    }
}
