package io.evalsandbox.core.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.evalsandbox.core.capture.OutputCapture;
import io.evalsandbox.core.error.EvalException;
import io.evalsandbox.core.error.EvalRuntimeException;
import io.evalsandbox.core.error.ResourceExhaustedException;
import io.evalsandbox.core.error.TerminatedEvaluatorException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.model.SessionId;
import io.evalsandbox.core.model.SessionState;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.spi.RuntimeInstance;
import java.lang.ref.Cleaner;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One isolated evaluation context plus its paired stdout/stderr captures. Created by
 * {@link SessionFactory#create}.
 *
 * <p>
 * The runtime runs on a dedicated worker thread owned by the session. {@link #evaluate} hands the program to
 * that thread and waits for the result; bytes the program writes to its output streams accumulate in the
 * captures and are only returned through {@link #drainStdout()} / {@link #drainStderr()}.
 *
 * <p>
 * Evaluations must be issued sequentially: a second {@link #evaluate} while one is in flight fails with
 * {@link IllegalStateException}. {@link #kill()}, {@link #isAlive()} and the drains may be called from any
 * thread at any time, which is how a caller imposes a deadline on a running evaluation.
 *
 * <p>
 * A session that becomes unreachable without being killed is torn down by a {@link Cleaner}.
 */
public final class Session implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Session.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final SessionId id;
    private final RuntimeInstance runtime;
    private final ExecutorService worker;
    private final OutputCapture stdout;
    private final OutputCapture stderr;
    private final CapabilityPolicy policy;
    private final MemoryLimit memoryLimit;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.READY);
    private final AtomicReference<Future<JsonNode>> inFlight = new AtomicReference<>();
    private final Cleaner.Cleanable cleanable;

    Session(
            SessionId id,
            RuntimeInstance runtime,
            ExecutorService worker,
            OutputCapture stdout,
            OutputCapture stderr,
            CapabilityPolicy policy,
            MemoryLimit memoryLimit) {
        this.id = id;
        this.runtime = runtime;
        this.worker = worker;
        this.stdout = stdout;
        this.stderr = stderr;
        this.policy = policy;
        this.memoryLimit = memoryLimit;
        this.cleanable = CLEANER.register(this, new Teardown(id, runtime, worker, stdout, stderr));
    }

    public SessionId id() {
        return id;
    }

    public SessionState state() {
        return state.get();
    }

    public CapabilityPolicy policy() {
        return policy;
    }

    public MemoryLimit memoryLimit() {
        return memoryLimit;
    }

    /**
     * Evaluates one program unit on the session's worker thread and blocks until it completes.
     *
     * @param program source text for the session's runtime
     * @return the computed value
     * @throws io.evalsandbox.core.error.EvalSyntaxException         malformed input; session stays alive
     * @throws EvalRuntimeException                                   the program raised an error; session stays
     *                                                                alive
     * @throws io.evalsandbox.core.error.AccessDeniedException       a capability was refused; session stays
     *                                                                alive
     * @throws ResourceExhaustedException                             memory limit breached; session is dead
     *                                                                afterwards
     * @throws TerminatedEvaluatorException                           the session is dead, or was killed while
     *                                                                this call was in flight
     * @throws IllegalStateException                                  another evaluation is in flight
     */
    public JsonNode evaluate(String program) {
        Objects.requireNonNull(program, "program must not be null");
        if (!state.compareAndSet(SessionState.READY, SessionState.EVALUATING)) {
            if (state.get() == SessionState.DEAD) {
                throw new TerminatedEvaluatorException(id);
            }
            throw new IllegalStateException("session " + id + " is already evaluating; serialize evaluate calls");
        }
        RuntimeInstance rt = runtime;
        try {
            Future<JsonNode> future;
            try {
                future = worker.submit(() -> rt.submit(program));
            } catch (RejectedExecutionException e) {
                throw new TerminatedEvaluatorException(id);
            }
            inFlight.set(future);
            if (state.get() == SessionState.DEAD) {
                // killed between the state check and publishing the future
                future.cancel(true);
            }
            return awaitResult(future);
        } finally {
            inFlight.set(null);
            state.compareAndSet(SessionState.EVALUATING, SessionState.READY);
        }
    }

    /** Returns and clears everything written to standard output since the last drain. */
    public byte[] drainStdout() {
        return stdout.drain();
    }

    /** Returns and clears everything written to standard error since the last drain. */
    public byte[] drainStderr() {
        return stderr.drain();
    }

    /** {@link #drainStdout()} decoded as UTF-8. */
    public String drainStdoutText() {
        return stdout.drainText();
    }

    /** {@link #drainStderr()} decoded as UTF-8. */
    public String drainStderrText() {
        return stderr.drainText();
    }

    /** Drains both streams and discards the content. */
    public void flush() {
        stdout.drain();
        stderr.drain();
    }

    /** Non-blocking liveness check. {@code false} once killed or dead from memory exhaustion. */
    public boolean isAlive() {
        return state.get().isAlive() && runtime.isRunning();
    }

    /**
     * Terminates the runtime and its worker thread immediately. An in-flight evaluation fails with
     * {@link TerminatedEvaluatorException}; buffered output stays drainable. Idempotent.
     */
    public void kill() {
        if (transitionToDead()) {
            LOG.info("Session killed: session_id={}", id);
        }
    }

    /** Alias for {@link #kill()}. */
    @Override
    public void close() {
        kill();
    }

    @Override
    public String toString() {
        return "Session[" + id + ", " + state.get() + "]";
    }

    private JsonNode awaitResult(Future<JsonNode> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            throw new TerminatedEvaluatorException(id);
        } catch (ExecutionException e) {
            throw translate(e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new EvalRuntimeException("interrupted while waiting for evaluation", e).withSession(id);
        }
    }

    /** Maps a failure raised on the worker thread to the exception the caller sees. */
    private EvalException translate(Throwable cause) {
        if (cause instanceof ResourceExhaustedException exhausted) {
            die(exhausted.getMessage());
            return exhausted.withSession(id);
        }
        if (cause instanceof OutOfMemoryError oom) {
            die("out of memory");
            return new ResourceExhaustedException(
                            "out of memory: runtime exhausted the heap (limit " + memoryLimit.bytes() + " bytes)",
                            oom,
                            memoryLimit.bytes())
                    .withSession(id);
        }
        if (state.get() == SessionState.DEAD) {
            return new TerminatedEvaluatorException(id);
        }
        if (cause instanceof EvalException evalException) {
            if (evalException.isTerminal()) {
                die(evalException.getMessage());
            }
            return evalException.withSession(id);
        }
        return new EvalRuntimeException("runtime failure: " + cause, cause).withSession(id);
    }

    private void die(String reason) {
        if (transitionToDead()) {
            LOG.info("Session died: session_id={}, reason={}", id, reason);
        }
    }

    private boolean transitionToDead() {
        SessionState previous = state.getAndSet(SessionState.DEAD);
        if (previous == SessionState.DEAD) {
            return false;
        }
        Future<JsonNode> running = inFlight.get();
        if (running != null) {
            running.cancel(true);
        }
        cleanable.clean();
        return true;
    }

    /**
     * Releases a session's resources. Runs exactly once: on kill, on death, or when the session becomes
     * unreachable. Must not reference the {@link Session} itself.
     */
    private static final class Teardown implements Runnable {

        private final SessionId id;
        private final RuntimeInstance runtime;
        private final ExecutorService worker;
        private final OutputCapture stdout;
        private final OutputCapture stderr;

        Teardown(
                SessionId id,
                RuntimeInstance runtime,
                ExecutorService worker,
                OutputCapture stdout,
                OutputCapture stderr) {
            this.id = id;
            this.runtime = runtime;
            this.worker = worker;
            this.stdout = stdout;
            this.stderr = stderr;
        }

        @Override
        public void run() {
            runtime.terminate();
            worker.shutdownNow();
            stdout.close();
            stderr.close();
            LOG.debug("Session resources released: session_id={}", id);
        }
    }
}
