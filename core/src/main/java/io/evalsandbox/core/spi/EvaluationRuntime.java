package io.evalsandbox.core.spi;

import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.CapabilityPolicy;
import java.io.OutputStream;

/**
 * Pluggable evaluation runtime SPI. Implementations provide a specific language and are discovered through
 * {@code META-INF/services} or registered with {@code RuntimeRegistry} directly.
 *
 * <p>
 * Implementations MUST be stateless and thread-safe; all per-session state lives in the
 * {@link RuntimeInstance} returned by {@link #start}.
 */
public interface EvaluationRuntime {

    /**
     * Returns the runtime identifier, e.g. {@code "datalog"}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Starts an isolated execution context. Called on the session's worker thread, which is the only thread
     * that will ever call {@link RuntimeInstance#submit} on the result.
     *
     * @param policy      capabilities the context may use; every filesystem, network and process operation
     *                    must be checked against it
     * @param memoryLimit ceiling on live allocation inside the context
     * @param stdout      sink for everything evaluated code writes to standard output (may block when full)
     * @param stderr      sink for everything evaluated code writes to standard error (may block when full)
     * @return the running instance
     * @throws RuntimeException any failure; the session factory reports it as an initialization error
     */
    RuntimeInstance start(CapabilityPolicy policy, MemoryLimit memoryLimit, OutputStream stdout, OutputStream stderr);
}
