package io.evalsandbox.core.session;

import io.evalsandbox.core.capture.OutputCapture;
import io.evalsandbox.core.error.InitializationException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.model.SessionId;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.runtime.datalog.DatalogRuntime;
import io.evalsandbox.core.spi.EvaluationRuntime;
import io.evalsandbox.core.spi.RuntimeInstance;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates {@link Session}s. Thread-safe; one factory can serve any number of concurrent {@code create} calls.
 *
 * <p>
 * Creation protocol: allocate two fresh {@link OutputCapture}s, spawn the session's worker thread, start the
 * runtime on that thread, and block until the worker posts the started instance (or the failure) to a
 * one-shot {@link CompletableFuture}. The caller waits on that rendezvous exactly once.
 */
public final class SessionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SessionFactory.class);

    /** Default wait for the runtime's readiness signal. */
    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(10);

    private final EvaluationRuntime runtime;
    private final int captureCapacity;
    private final Duration startupTimeout;

    private SessionFactory(Builder builder) {
        this.runtime = builder.runtime != null ? builder.runtime : new DatalogRuntime();
        this.captureCapacity = builder.captureCapacity;
        this.startupTimeout = builder.startupTimeout;
    }

    /** A factory using the bundled Datalog runtime and default capacities. */
    public static SessionFactory withDefaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public EvaluationRuntime runtime() {
        return runtime;
    }

    /** Creates a session with the default memory limit and the default policy for the working directory. */
    public Session create() {
        return create(MemoryLimit.DEFAULT, CapabilityPolicy.defaults());
    }

    /** Creates a session with the given memory limit and the default policy. */
    public Session create(MemoryLimit memoryLimit) {
        return create(memoryLimit, CapabilityPolicy.defaults());
    }

    /**
     * Creates a session and blocks until its runtime is ready.
     *
     * @param memoryLimit ceiling on live allocation inside the runtime
     * @param policy      capabilities granted to evaluated code
     * @return a live session in state {@code READY}
     * @throws InitializationException if the runtime fails to start, does not become ready within the startup
     *                                 timeout, or the caller is interrupted while waiting
     */
    public Session create(MemoryLimit memoryLimit, CapabilityPolicy policy) {
        Objects.requireNonNull(memoryLimit, "memoryLimit must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        SessionId id = SessionId.next();
        OutputCapture stdout = new OutputCapture(captureCapacity);
        OutputCapture stderr = new OutputCapture(captureCapacity);
        ExecutorService worker = Executors.newSingleThreadExecutor(task -> {
            Thread thread = new Thread(task, id + "-worker");
            thread.setDaemon(true);
            return thread;
        });

        CompletableFuture<RuntimeInstance> ready = new CompletableFuture<>();
        worker.execute(() -> {
            try {
                ready.complete(runtime.start(policy, memoryLimit, stdout.sink(), stderr.sink()));
            } catch (RuntimeException | Error e) {
                ready.completeExceptionally(e);
            }
        });

        RuntimeInstance instance;
        try {
            instance = ready.get(startupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            abort(ready, worker, stdout, stderr);
            Throwable cause = e.getCause();
            throw new InitializationException(
                    "evaluation runtime '" + runtime.id() + "' failed to start: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            abort(ready, worker, stdout, stderr);
            throw new InitializationException("evaluation runtime '" + runtime.id()
                    + "' did not become ready within " + startupTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            abort(ready, worker, stdout, stderr);
            Thread.currentThread().interrupt();
            throw new InitializationException("interrupted while waiting for runtime '" + runtime.id() + "'", e);
        }

        Session session = new Session(id, instance, worker, stdout, stderr, policy, memoryLimit);
        LOG.info(
                "Session created: session_id={}, runtime={}, memory_limit_bytes={}, network={}, process={}",
                id,
                runtime.id(),
                memoryLimit.bytes(),
                policy.networkAllowed(),
                policy.processAllowed());
        return session;
    }

    private static void abort(
            CompletableFuture<RuntimeInstance> ready,
            ExecutorService worker,
            OutputCapture stdout,
            OutputCapture stderr) {
        // a runtime that finishes starting after we gave up must not stay running
        ready.thenAccept(RuntimeInstance::terminate);
        worker.shutdownNow();
        stdout.close();
        stderr.close();
    }

    /** Builder for {@link SessionFactory}. */
    public static final class Builder {
        private EvaluationRuntime runtime;
        private int captureCapacity = OutputCapture.DEFAULT_CAPACITY;
        private Duration startupTimeout = DEFAULT_STARTUP_TIMEOUT;

        Builder() {}

        /** Runtime to start for each session (default: the bundled Datalog runtime). */
        public Builder runtime(EvaluationRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        /** Capacity of each stdout/stderr capture in bytes (default: 64 KiB). */
        public Builder captureCapacity(int captureCapacity) {
            if (captureCapacity <= 0) {
                throw new IllegalArgumentException("captureCapacity must be positive, got: " + captureCapacity);
            }
            this.captureCapacity = captureCapacity;
            return this;
        }

        /** Maximum wait for the runtime's readiness signal (default: 10 s). */
        public Builder startupTimeout(Duration startupTimeout) {
            if (startupTimeout == null || startupTimeout.isNegative() || startupTimeout.isZero()) {
                throw new IllegalArgumentException("startupTimeout must be positive, got: " + startupTimeout);
            }
            this.startupTimeout = startupTimeout;
            return this;
        }

        public SessionFactory build() {
            return new SessionFactory(this);
        }
    }
}
