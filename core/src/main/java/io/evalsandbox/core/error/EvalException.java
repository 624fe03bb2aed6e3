package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/**
 * Abstract parent for failures of a single {@code Session.evaluate()} call. Runtimes raise these without a
 * session id; the session re-raises them through {@link #withSession(SessionId)} so callers always see the
 * owning session.
 */
public abstract class EvalException extends SandboxException {

    private static final long serialVersionUID = 1L;

    protected EvalException(String message, SessionId sessionId) {
        super(message, sessionId, Phase.EVALUATION);
    }

    protected EvalException(String message, Throwable cause, SessionId sessionId) {
        super(message, cause, sessionId, Phase.EVALUATION);
    }

    /** Whether the session can keep evaluating after this failure. */
    public abstract boolean isTerminal();

    /**
     * Returns an equivalent exception bound to the given session. Returns {@code this} when already bound.
     *
     * @param sessionId the owning session
     * @return an exception of the same type and message carrying {@code sessionId}
     */
    public abstract EvalException withSession(SessionId sessionId);
}
