package io.evalsandbox.standalone.repl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.evalsandbox.core.error.AccessDeniedException;
import io.evalsandbox.core.error.EvalRuntimeException;
import io.evalsandbox.core.error.EvalSyntaxException;
import io.evalsandbox.core.error.InitializationException;
import io.evalsandbox.core.error.ResourceExhaustedException;
import io.evalsandbox.core.error.SandboxException;
import io.evalsandbox.core.error.TerminatedEvaluatorException;
import io.evalsandbox.core.model.MemoryLimit;
import io.evalsandbox.core.policy.CapabilityPolicy;
import io.evalsandbox.core.session.Session;
import io.evalsandbox.core.session.SessionFactory;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented read-eval-print loop over one {@link Session}.
 *
 * <p>
 * Each input line is evaluated as one program unit on a dedicated evaluator thread. While it runs, output is
 * drained from the session and echoed (standard output to {@code out}, standard error to {@code err}), so
 * output larger than the capture capacity never blocks the evaluation. The value follows as compact JSON.
 * Failures print {@code error[<type>]: <message>} and the loop continues. Lines starting with {@code :} are commands:
 * {@code :flush}, {@code :alive}, {@code :kill}, {@code :new} and {@code :quit}.
 */
public final class SandboxRepl {

    private static final Logger LOG = LoggerFactory.getLogger(SandboxRepl.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    static final String PROMPT = "> ";
    static final long DRAIN_INTERVAL_MS = 20;

    private final SessionFactory factory;
    private final MemoryLimit memoryLimit;
    private final CapabilityPolicy policy;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean interactive;
    private final ExecutorService evaluator = Executors.newSingleThreadExecutor(task -> {
        Thread thread = new Thread(task, "repl-evaluator");
        thread.setDaemon(true);
        return thread;
    });
    private Session session;
    private boolean outAtLineStart = true;
    private boolean errAtLineStart = true;

    public SandboxRepl(
            SessionFactory factory,
            MemoryLimit memoryLimit,
            CapabilityPolicy policy,
            BufferedReader in,
            PrintStream out,
            PrintStream err,
            boolean interactive) {
        this.factory = factory;
        this.memoryLimit = memoryLimit;
        this.policy = policy;
        this.in = in;
        this.out = out;
        this.err = err;
        this.interactive = interactive;
    }

    /**
     * Runs until end of input or {@code :quit}. The session is killed on return.
     *
     * @return process exit status: 0 on normal completion, 1 if the first session could not be created
     * @throws IOException if reading the input fails
     */
    public int run() throws IOException {
        try {
            session = factory.create(memoryLimit, policy);
        } catch (InitializationException e) {
            out.println(formatError(e));
            return 1;
        }
        try {
            while (true) {
                prompt();
                String line = in.readLine();
                if (line == null) {
                    break;
                }
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (trimmed.startsWith(":")) {
                    if (!command(trimmed)) {
                        break;
                    }
                } else {
                    evaluate(line);
                }
            }
            return 0;
        } finally {
            session.kill();
            evaluator.shutdownNow();
        }
    }

    /** The current session; replaced by {@code :new}. */
    Session session() {
        return session;
    }

    private void prompt() {
        if (interactive) {
            out.print(PROMPT);
            out.flush();
        }
    }

    private void evaluate(String program) {
        Session current = session;
        Future<JsonNode> pending = evaluator.submit(() -> current.evaluate(program));
        try {
            JsonNode value = awaitWhileDraining(pending);
            finishOutput();
            out.println(render(value));
        } catch (ExecutionException e) {
            finishOutput();
            Throwable cause = e.getCause();
            if (cause instanceof SandboxException failure) {
                out.println(formatError(failure));
            } else if (cause instanceof IllegalStateException stateFailure) {
                out.println("error[state]: " + stateFailure.getMessage());
            } else if (cause instanceof RuntimeException runtimeFailure) {
                throw runtimeFailure;
            } else {
                throw new IllegalStateException("evaluation failed", cause);
            }
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            out.println("error[state]: interrupted while waiting for evaluation");
        }
    }

    /** Waits for {@code pending}, echoing captured output so a full capture never stalls the evaluation. */
    private JsonNode awaitWhileDraining(Future<JsonNode> pending) throws ExecutionException, InterruptedException {
        while (true) {
            try {
                return pending.get(DRAIN_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                echoOutput();
            }
        }
    }

    /** Executes a command; returns {@code false} when the loop should stop. */
    private boolean command(String command) {
        switch (command) {
            case ":quit" -> {
                return false;
            }
            case ":flush" -> {
                session.flush();
                out.println("flushed");
            }
            case ":alive" -> out.println(session.isAlive());
            case ":kill" -> {
                session.kill();
                out.println("killed " + session.id());
            }
            case ":new" -> {
                session.kill();
                try {
                    session = factory.create(memoryLimit, policy);
                    out.println("new " + session.id());
                } catch (InitializationException e) {
                    out.println(formatError(e));
                }
            }
            default -> out.println("error[command]: unknown command '" + command + "'");
        }
        return true;
    }

    private void echoOutput() {
        byte[] stdout = session.drainStdout();
        if (stdout.length > 0) {
            out.write(stdout, 0, stdout.length);
            out.flush();
            outAtLineStart = stdout[stdout.length - 1] == '\n';
        }
        byte[] stderr = session.drainStderr();
        if (stderr.length > 0) {
            err.write(stderr, 0, stderr.length);
            err.flush();
            errAtLineStart = stderr[stderr.length - 1] == '\n';
        }
    }

    /** Echoes what is left and ends any unterminated output line. */
    private void finishOutput() {
        echoOutput();
        if (!outAtLineStart) {
            out.println();
            outAtLineStart = true;
        }
        if (!errAtLineStart) {
            err.println();
            err.flush();
            errAtLineStart = true;
        }
    }

    private static String render(JsonNode value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.warn("Result rendering failed: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    /** {@code error[<type>]: <message>} for a sandbox failure. */
    static String formatError(SandboxException e) {
        return "error[" + errorType(e) + "]: " + e.getMessage();
    }

    static String errorType(SandboxException e) {
        if (e instanceof EvalSyntaxException) {
            return "syntax";
        }
        if (e instanceof EvalRuntimeException) {
            return "runtime";
        }
        if (e instanceof ResourceExhaustedException) {
            return "resource-exhausted";
        }
        if (e instanceof AccessDeniedException denied) {
            return "access-denied:" + denied.kind().label();
        }
        if (e instanceof TerminatedEvaluatorException) {
            return "terminated";
        }
        if (e instanceof InitializationException) {
            return "initialization";
        }
        return "sandbox";
    }
}
