package io.evalsandbox.core.runtime.datalog;

import io.evalsandbox.core.error.EvalRuntimeException;
import io.evalsandbox.core.policy.CapabilityGuard;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Built-in predicates. Each built-in receives its arguments with the caller's bindings applied and either
 * fails (no answer), succeeds with the argument list completed (output positions filled in), or raises an
 * {@link EvalRuntimeException}. Arguments documented as inputs must be bound.
 *
 * <p>
 * Every built-in that touches the filesystem, the network or child processes asks the
 * {@link CapabilityGuard} first; a refusal propagates unchanged.
 */
final class Builtins {

    static final int CONNECT_TIMEOUT_MS = 5000;
    static final int EXEC_CHUNK_BYTES = 8192;

    @FunctionalInterface
    private interface Builtin {
        /** Returns the completed arguments, or {@code null} when the built-in fails. */
        List<Term> apply(String signature, List<Term> args) throws IOException;
    }

    private final CapabilityGuard guard;
    private final OutputStream stdout;
    private final OutputStream stderr;
    private final MemoryMeter meter;
    private final Map<String, Builtin> table = new HashMap<>();
    private final Map<String, Integer> arities = new HashMap<>();

    Builtins(CapabilityGuard guard, OutputStream stdout, OutputStream stderr, MemoryMeter meter) {
        this.guard = guard;
        this.stdout = stdout;
        this.stderr = stderr;
        this.meter = meter;

        define("add", 3, (sig, a) -> withResult(a, arithmetic(sig, a, Math::addExact)));
        define("sub", 3, (sig, a) -> withResult(a, arithmetic(sig, a, Math::subtractExact)));
        define("mul", 3, (sig, a) -> withResult(a, arithmetic(sig, a, Math::multiplyExact)));
        define("lt", 2, (sig, a) -> intArg(sig, a, 0) < intArg(sig, a, 1) ? a : null);
        define("neq", 2, (sig, a) -> bound(sig, a, 0).equals(bound(sig, a, 1)) ? null : a);
        define("concat", 3, this::concat);
        define("print", 1, (sig, a) -> emit(sig, this.stdout, a));
        define("eprint", 1, (sig, a) -> emit(sig, this.stderr, a));
        define("error", 1, (sig, a) -> {
            throw new EvalRuntimeException("error: " + bound(sig, a, 0).displayText());
        });
        define("read_file", 2, this::readFile);
        define("write_file", 2, this::writeFile);
        define("delete_file", 1, this::deleteFile);
        define("file_exists", 1, this::fileExists);
        define("connect", 2, this::connect);
        define("listen", 1, this::listen);
        define("exec", 2, this::exec);
    }

    /** Whether {@code predicate} names a built-in, at any arity. */
    boolean isReserved(String predicate) {
        return arities.containsKey(predicate);
    }

    /**
     * Runs the built-in for {@code goal}.
     *
     * @return the goal with output arguments filled in, or empty when the built-in fails
     */
    Optional<Literal> solve(Literal goal) {
        Builtin builtin = table.get(goal.key());
        if (builtin == null) {
            throw new EvalRuntimeException(goal.key() + " is not defined; built-in " + goal.predicate() + " takes "
                    + arities.get(goal.predicate()) + " argument(s)");
        }
        try {
            List<Term> completed = builtin.apply(goal.key(), goal.args());
            return completed == null ? Optional.empty() : Optional.of(new Literal(goal.predicate(), completed));
        } catch (IOException e) {
            throw new EvalRuntimeException(goal.key() + ": " + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private void define(String name, int arity, Builtin builtin) {
        table.put(name + "/" + arity, builtin);
        arities.put(name, arity);
    }

    // --- Pure built-ins ---

    private interface LongOp {
        long apply(long a, long b);
    }

    private static Term arithmetic(String sig, List<Term> args, LongOp op) {
        try {
            return new Term.Int(op.apply(intArg(sig, args, 0), intArg(sig, args, 1)));
        } catch (ArithmeticException e) {
            throw new EvalRuntimeException(sig + ": integer overflow", e);
        }
    }

    private List<Term> concat(String sig, List<Term> args) {
        String left = bound(sig, args, 0).displayText();
        String right = bound(sig, args, 1).displayText();
        meter.ensureAvailable(MemoryMeter.sizeOfText((long) left.length() + right.length()));
        return withResult(args, new Term.Str(left + right));
    }

    private static List<Term> emit(String sig, OutputStream out, List<Term> args) throws IOException {
        byte[] bytes = bound(sig, args, 0).displayText().getBytes(StandardCharsets.UTF_8);
        out.write(bytes);
        out.flush();
        return args;
    }

    // --- Capability-checked built-ins ---

    private List<Term> readFile(String sig, List<Term> args) throws IOException {
        Path path = guard.checkRead(textArg(sig, args, 0));
        meter.ensureAvailable(MemoryMeter.sizeOfText(Files.size(path)));
        return withResult(args, new Term.Str(Files.readString(path, StandardCharsets.UTF_8)));
    }

    private List<Term> writeFile(String sig, List<Term> args) throws IOException {
        Path path = guard.checkWrite(textArg(sig, args, 0));
        Files.writeString(path, bound(sig, args, 1).displayText(), StandardCharsets.UTF_8);
        return args;
    }

    private List<Term> deleteFile(String sig, List<Term> args) throws IOException {
        Files.delete(guard.checkWrite(textArg(sig, args, 0)));
        return args;
    }

    private List<Term> fileExists(String sig, List<Term> args) {
        return Files.exists(guard.checkRead(textArg(sig, args, 0))) ? args : null;
    }

    private List<Term> connect(String sig, List<Term> args) throws IOException {
        String host = textArg(sig, args, 0);
        int port = portArg(sig, args, 1);
        guard.checkConnect(host, port);
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MS);
        }
        return args;
    }

    private List<Term> listen(String sig, List<Term> args) throws IOException {
        int port = portArg(sig, args, 0);
        guard.checkListen(port);
        try (ServerSocket ignored = new ServerSocket(port)) {
            return args;
        }
    }

    private List<Term> exec(String sig, List<Term> args) throws IOException {
        String command = textArg(sig, args, 0);
        guard.checkExecute(command);
        Process process = new ProcessBuilder("/bin/sh", "-c", command)
                .redirectErrorStream(true)
                .start();
        try (InputStream in = process.getInputStream()) {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            byte[] chunk = new byte[EXEC_CHUNK_BYTES];
            int read;
            while ((read = in.read(chunk)) != -1) {
                // charged before the chunk is retained
                meter.ensureAvailable(MemoryMeter.sizeOfText((long) output.size() + read));
                output.write(chunk, 0, read);
            }
            process.waitFor();
            return withResult(args, new Term.Str(output.toString(StandardCharsets.UTF_8)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvalRuntimeException(sig + ": interrupted while waiting for '" + command + "'", e);
        } finally {
            process.destroyForcibly();
        }
    }

    // --- Argument helpers ---

    private static List<Term> withResult(List<Term> args, Term result) {
        List<Term> completed = new ArrayList<>(args);
        completed.set(args.size() - 1, result);
        return completed;
    }

    private static Term bound(String sig, List<Term> args, int index) {
        Term term = args.get(index);
        if (!term.isGround()) {
            throw new EvalRuntimeException(sig + ": argument " + (index + 1) + " is not sufficiently instantiated");
        }
        return term;
    }

    private static long intArg(String sig, List<Term> args, int index) {
        Term term = bound(sig, args, index);
        if (term instanceof Term.Int n) {
            return n.value();
        }
        throw new EvalRuntimeException(sig + ": argument " + (index + 1) + " must be an integer, got " + term);
    }

    private static int portArg(String sig, List<Term> args, int index) {
        long port = intArg(sig, args, index);
        if (port < 0 || port > 65535) {
            throw new EvalRuntimeException(sig + ": port out of range: " + port);
        }
        return (int) port;
    }

    private static String textArg(String sig, List<Term> args, int index) {
        Term term = bound(sig, args, index);
        if (term instanceof Term.Str s) {
            return s.value();
        }
        if (term instanceof Term.Symbol s) {
            return s.name();
        }
        throw new EvalRuntimeException(sig + ": argument " + (index + 1) + " must be a string, got " + term);
    }
}
