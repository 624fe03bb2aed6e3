package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/** Thrown when evaluated code raises an error. The session stays alive. */
public final class EvalRuntimeException extends EvalException {

    private static final long serialVersionUID = 1L;

    public EvalRuntimeException(String message) {
        super(message, null);
    }

    public EvalRuntimeException(String message, Throwable cause) {
        super(message, cause, null);
    }

    private EvalRuntimeException(String message, Throwable cause, SessionId sessionId) {
        super(message, cause, sessionId);
    }

    @Override
    public boolean isTerminal() {
        return false;
    }

    @Override
    public EvalException withSession(SessionId sessionId) {
        if (sessionId() != null) {
            return this;
        }
        EvalRuntimeException bound = new EvalRuntimeException(getMessage(), getCause(), sessionId);
        bound.setStackTrace(getStackTrace());
        return bound;
    }
}
