package io.evalsandbox.core.error;

import io.evalsandbox.core.model.SessionId;
import io.evalsandbox.core.policy.AccessKind;

/**
 * Thrown when evaluated code attempts an operation the session's capability policy forbids. The message
 * always names the violated {@link AccessKind}. The session stays alive.
 */
public final class AccessDeniedException extends EvalException {

    private static final long serialVersionUID = 1L;

    private final AccessKind kind;
    private final String target;

    public AccessDeniedException(AccessKind kind, String target) {
        this(kind, target, null);
    }

    private AccessDeniedException(AccessKind kind, String target, SessionId sessionId) {
        super("access denied: " + kind.label() + " of " + target + " is not permitted", sessionId);
        this.kind = kind;
        this.target = target;
    }

    /** The capability that was refused. */
    public AccessKind kind() {
        return kind;
    }

    /** The path, address or command the denied operation targeted. */
    public String target() {
        return target;
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
        AccessDeniedException bound = new AccessDeniedException(kind, target, sessionId);
        bound.setStackTrace(getStackTrace());
        return bound;
    }
}
