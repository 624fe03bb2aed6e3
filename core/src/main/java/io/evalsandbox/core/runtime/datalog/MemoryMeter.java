package io.evalsandbox.core.runtime.datalog;

import io.evalsandbox.core.error.ResourceExhaustedException;

/**
 * Accounts the live allocation of one Datalog instance against its memory limit. Every stored or derived fact
 * is charged an estimated size when created and released when dropped. Confined to the session's worker
 * thread.
 */
final class MemoryMeter {

    private static final long LITERAL_OVERHEAD = 64;
    private static final long ARG_SLOT = 16;
    private static final long TERM_OVERHEAD = 24;

    private final long limitBytes;
    private long usedBytes;

    MemoryMeter(long limitBytes) {
        this.limitBytes = limitBytes;
    }

    /**
     * Charges {@code bytes} of new live allocation.
     *
     * @throws ResourceExhaustedException if the limit would be exceeded; nothing is charged in that case
     */
    void charge(long bytes) {
        ensureAvailable(bytes);
        usedBytes += bytes;
    }

    /** Fails like {@link #charge} would, without charging. Used before building large values. */
    void ensureAvailable(long bytes) {
        long next = usedBytes + bytes;
        if (next > limitBytes || next < 0) {
            throw new ResourceExhaustedException(next < 0 ? Long.MAX_VALUE : next, limitBytes);
        }
    }

    void release(long bytes) {
        usedBytes = Math.max(0, usedBytes - bytes);
    }

    long usedBytes() {
        return usedBytes;
    }

    long limitBytes() {
        return limitBytes;
    }

    /** Estimated retained size of a fact. */
    static long sizeOf(Literal literal) {
        long size = LITERAL_OVERHEAD + 2L * literal.predicate().length();
        for (Term arg : literal.args()) {
            size += ARG_SLOT + sizeOf(arg);
        }
        return size;
    }

    /** Estimated retained size of a rule. */
    static long sizeOf(Clause clause) {
        long size = sizeOf(clause.head());
        for (Literal literal : clause.body()) {
            size += sizeOf(literal);
        }
        return size;
    }

    /** Estimated retained size of a string of {@code length} chars. */
    static long sizeOfText(long length) {
        return TERM_OVERHEAD + 2L * length;
    }

    private static long sizeOf(Term term) {
        if (term instanceof Term.Str s) {
            return sizeOfText(s.value().length());
        }
        if (term instanceof Term.Symbol s) {
            return sizeOfText(s.name().length());
        }
        return TERM_OVERHEAD;
    }
}
