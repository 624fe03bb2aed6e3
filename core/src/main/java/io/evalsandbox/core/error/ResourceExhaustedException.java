package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/**
 * Thrown when live allocation inside the runtime exceeds the session's memory limit. Terminal: the session
 * is dead once this has been raised.
 */
public final class ResourceExhaustedException extends EvalException {

    private static final long serialVersionUID = 1L;

    private final long limitBytes;

    public ResourceExhaustedException(long requestedBytes, long limitBytes) {
        this(
                "out of memory: live allocation of " + requestedBytes + " bytes exceeds the limit of " + limitBytes
                        + " bytes",
                null,
                limitBytes,
                null);
    }

    public ResourceExhaustedException(String message, Throwable cause, long limitBytes) {
        this(message, cause, limitBytes, null);
    }

    private ResourceExhaustedException(String message, Throwable cause, long limitBytes, SessionId sessionId) {
        super(message, cause, sessionId);
        this.limitBytes = limitBytes;
    }

    /** The memory limit that was breached, in bytes. */
    public long limitBytes() {
        return limitBytes;
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public EvalException withSession(SessionId sessionId) {
        if (sessionId() != null) {
            return this;
        }
        ResourceExhaustedException bound = new ResourceExhaustedException(getMessage(), getCause(), limitBytes, sessionId);
        bound.setStackTrace(getStackTrace());
        return bound;
    }
}
