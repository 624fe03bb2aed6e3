package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/**
 * Thrown when {@code evaluate} is called on a dead session, or when the session is killed while an
 * evaluation is in flight. Raised for every further evaluation once the session is dead, regardless of
 * whether it was killed or ran out of memory.
 */
public final class TerminatedEvaluatorException extends EvalException {

    private static final long serialVersionUID = 1L;

    /** Raised by a runtime that observes its own termination; the session binds it afterwards. */
    public TerminatedEvaluatorException() {
        super("evaluator terminated", null);
    }

    public TerminatedEvaluatorException(SessionId sessionId) {
        super("evaluator terminated: session " + sessionId + " is dead", sessionId);
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public EvalException withSession(SessionId sessionId) {
        return sessionId() != null ? this : new TerminatedEvaluatorException(sessionId);
    }
}
