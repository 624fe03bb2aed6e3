package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;

/** Thrown when the submitted program is malformed. The session stays alive. */
public final class EvalSyntaxException extends EvalException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public EvalSyntaxException(String message, int line, int column) {
        this(message, line, column, null);
    }

    private EvalSyntaxException(String message, int line, int column, SessionId sessionId) {
        super(message, sessionId);
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the offending token, or 0 when unknown. */
    public int line() {
        return line;
    }

    /** 1-based column of the offending token, or 0 when unknown. */
    public int column() {
        return column;
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
        EvalSyntaxException bound = new EvalSyntaxException(getMessage(), line, column, sessionId);
        bound.setStackTrace(getStackTrace());
        return bound;
    }
}
