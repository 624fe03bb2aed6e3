package io.evalsandbox.core.error;

/**
 * Thrown by {@code SessionFactory.create()} when the evaluation runtime cannot be started. No session is
 * returned; the partially started worker is torn down before this is raised.
 */
public final class InitializationException extends SandboxException {

    private static final long serialVersionUID = 1L;

    public InitializationException(String message) {
        super(message, null, Phase.STARTUP);
    }

    public InitializationException(String message, Throwable cause) {
        super(message, cause, null, Phase.STARTUP);
    }
}
