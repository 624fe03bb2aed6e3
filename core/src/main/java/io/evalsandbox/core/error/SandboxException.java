package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/**
 * Abstract base for all evalsandbox exceptions. Never thrown directly; use {@link InitializationException}
 * or one of the {@link EvalException} subclasses.
 */
public abstract class SandboxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        STARTUP,
        EVALUATION
    }

    private final transient SessionId sessionId;
    private final Phase phase;

    protected SandboxException(String message, SessionId sessionId, Phase phase) {
        super(message);
        this.sessionId = sessionId;
        this.phase = phase;
    }

    protected SandboxException(String message, Throwable cause, SessionId sessionId, Phase phase) {
        super(message, cause);
        this.sessionId = sessionId;
        this.phase = phase;
    }

    /** The session the error belongs to, or {@code null} if raised before a session existed. */
    public SessionId sessionId() {
        return sessionId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
