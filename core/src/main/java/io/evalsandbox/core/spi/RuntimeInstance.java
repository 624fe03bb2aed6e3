package io.evalsandbox.core.spi;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handle to one running, isolated execution context produced by {@link EvaluationRuntime#start}.
 *
 * <p>
 * {@link #submit} is only ever called from the owning session's worker thread, one call at a time.
 * {@link #terminate()} and {@link #isRunning()} may be called from any thread.
 */
public interface RuntimeInstance {

    /**
     * Evaluates one program unit.
     *
     * @param program source text
     * @return the computed value
     * @throws io.evalsandbox.core.error.EvalException on syntax errors, raised errors, capability refusals,
     *     memory exhaustion, or when terminated mid-evaluation
     */
    JsonNode submit(String program);

    /** Stops the context. An in-flight {@link #submit} aborts at its next step. Idempotent. */
    void terminate();

    /** {@code false} once terminated or dead from memory exhaustion. */
    boolean isRunning();
}
