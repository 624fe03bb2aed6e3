package io.evalsandbox.core.model;

/**
 * Lifecycle of a session: {@code READY ⇄ EVALUATING → DEAD}. {@link #DEAD} is terminal.
 *
 * <p>
 * Initialization happens inside {@code SessionFactory.create()}, which only returns once the runtime has
 * signalled readiness, so a session handed to its owner always starts in {@link #READY}.
 */
public enum SessionState {
    /** Idle and accepting evaluations. */
    READY,
    /** An evaluation is in flight. */
    EVALUATING,
    /** Killed or out of memory. Only drains are permitted. */
    DEAD;

    /** Whether the runtime is still running in this state. */
    public boolean isAlive() {
        return this != DEAD;
    }
}
